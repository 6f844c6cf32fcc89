package com.housingocr.service.impl;

import cn.hutool.core.codec.Base64;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.housingocr.config.OcrProperties;
import com.housingocr.exception.TextExtractionException;
import com.housingocr.service.TextExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * OCR 服务实现
 *
 * <p>调用 OpenAI 兼容的视觉模型接口（例如 vLLM 部署的 dots.ocr）：</p>
 * <ol>
 *   <li>PDF 在独立线程池中逐页栅格化，图片直接解码</li>
 *   <li>每页缩放到最长边不超过 maxImageSize，编码为 PNG 后以 data URI 提交</li>
 *   <li>按页拼接识别结果，空白页跳过</li>
 * </ol>
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Slf4j
@Service
public class TextExtractionServiceImpl implements TextExtractionService {

    private static final String OCR_PROMPT = """
        Please output the layout information from the PDF image, including each layout element's category, \
        and the corresponding text content within. IMPORTANT: Extract ALL text content from the image, \
        including headers, titles, small text, and any other text near the edges of the document.

        1. Layout Categories: The possible categories are ['Caption', 'Footnote', 'List-item', 'Page-footer', \
        'Page-header', 'Title', 'Table', 'Text'].

        2. Text Extraction & Formatting Rules:
           - Table: Format its text as HTML.
           - All Others (Text, Title, etc.): Format their text as Markdown.

        3. Constraints:
           - The output text must be the original text from the image, with no translation.
           - All layout elements must be sorted according to human reading order.
           - CRITICAL: Ensure ALL text is captured, including headers, footers, and any small text near document edges.

        4. Final Output: The entire output must be a single JSON object.
        """;

    private final RestTemplate restTemplate;
    private final OcrProperties ocrProperties;
    private final Executor pdfRenderExecutor;

    public TextExtractionServiceImpl(@Qualifier("ocrRestTemplate") RestTemplate restTemplate,
                                     OcrProperties ocrProperties,
                                     @Qualifier("pdfRenderExecutor") Executor pdfRenderExecutor) {
        this.restTemplate = restTemplate;
        this.ocrProperties = ocrProperties;
        this.pdfRenderExecutor = pdfRenderExecutor;
    }

    @Override
    public String extractText(String filePath, Long documentId) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            throw new TextExtractionException("文件不存在: " + filePath);
        }
        log.info("开始OCR提取: documentId={}, file={}", documentId, path.getFileName());

        if (filePath.toLowerCase().endsWith(".pdf")) {
            List<BufferedImage> pages = renderPdfAsync(path);
            if (pages.isEmpty()) {
                throw new TextExtractionException("PDF文件为空或无法读取: " + filePath);
            }
            List<String> pageTexts = new ArrayList<>();
            for (int i = 0; i < pages.size(); i++) {
                String text = extractFromImage(pages.get(i));
                // 尽早释放已提交的页面
                pages.set(i, null);
                if (StrUtil.isNotBlank(text)) {
                    pageTexts.add("[Page " + (i + 1) + "]\n" + text);
                }
            }
            String result = String.join("\n\n", pageTexts);
            log.info("OCR完成: documentId={}, pages={}, length={}", documentId, pages.size(), result.length());
            return result;
        }

        BufferedImage image = readImage(path);
        String result = extractFromImage(resize(image));
        log.info("OCR完成: documentId={}, length={}", documentId, result.length());
        return result;
    }

    /**
     * 在 PDF 渲染线程池中栅格化，调用方线程等待结果
     */
    private List<BufferedImage> renderPdfAsync(Path path) {
        try {
            return CompletableFuture.supplyAsync(() -> renderPdf(path), pdfRenderExecutor).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof TextExtractionException extractionException) {
                throw extractionException;
            }
            throw new TextExtractionException("PDF渲染失败: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private List<BufferedImage> renderPdf(Path path) {
        List<BufferedImage> images = new ArrayList<>();
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            PDFRenderer renderer = new PDFRenderer(document);
            for (int page = 0; page < document.getNumberOfPages(); page++) {
                BufferedImage image = renderer.renderImageWithDPI(page, ocrProperties.getPdfDpi(), ImageType.RGB);
                images.add(resize(image));
            }
        } catch (IOException e) {
            throw new TextExtractionException("PDF文件无法读取: " + e.getMessage(), e);
        }
        return images;
    }

    private BufferedImage readImage(Path path) {
        try {
            BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                throw new TextExtractionException("不支持的图片格式: " + path.getFileName());
            }
            return image;
        } catch (IOException e) {
            throw new TextExtractionException("图片读取失败: " + e.getMessage(), e);
        }
    }

    /**
     * 等比缩放到最长边不超过 maxImageSize
     */
    BufferedImage resize(BufferedImage image) {
        int maxSize = ocrProperties.getMaxImageSize();
        int width = image.getWidth();
        int height = image.getHeight();
        if (width <= maxSize && height <= maxSize) {
            return image;
        }

        double ratio = Math.min((double) maxSize / width, (double) maxSize / height);
        int newWidth = Math.max(1, (int) Math.round(width * ratio));
        int newHeight = Math.max(1, (int) Math.round(height * ratio));

        BufferedImage resized = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = resized.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(image, 0, 0, newWidth, newHeight, null);
        } finally {
            graphics.dispose();
        }
        return resized;
    }

    private String extractFromImage(BufferedImage image) {
        Map<String, Object> payload = Map.of(
            "model", ocrProperties.getModel(),
            "messages", List.of(Map.of(
                "role", "user",
                "content", List.of(
                    Map.of("type", "text", "text", OCR_PROMPT),
                    Map.of("type", "image_url", "image_url", Map.of("url", "data:image/png;base64," + toBase64Png(image)))
                )
            )),
            "temperature", ocrProperties.getTemperature()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        JsonNode response;
        try {
            response = restTemplate.postForObject(chatCompletionsUrl(), new HttpEntity<>(payload, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new TextExtractionException("OCR请求失败: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new TextExtractionException("OCR响应为空");
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode()) {
            throw new TextExtractionException("OCR响应格式错误");
        }
        return content.isNull() ? "" : content.asText();
    }

    private String chatCompletionsUrl() {
        return StrUtil.removeSuffix(ocrProperties.getEndpoint(), "/") + "/chat/completions";
    }

    private String toBase64Png(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return Base64.encode(out.toByteArray());
        } catch (IOException e) {
            throw new TextExtractionException("图片编码失败: " + e.getMessage(), e);
        }
    }
}
