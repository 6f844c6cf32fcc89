package com.housingocr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.housingocr.config.LlmProperties;
import com.housingocr.exception.CandidatesExhaustedException;
import com.housingocr.service.ModelCandidateService;
import com.housingocr.service.PropertyExtractionService;
import com.housingocr.utils.JapaneseEraUtils;
import com.housingocr.utils.LLMJsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import top.continew.starter.core.exception.BusinessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 房产字段抽取实现（多模型故障转移）
 *
 * <p>候选模型按顺序尝试，结果分类处理：</p>
 * <ul>
 *   <li>429 限流：记录时间，冷却期内跳过该模型</li>
 *   <li>其他 HTTP / 网络错误、响应无法解析：换下一个模型</li>
 *   <li>有效字段少于 minMeaningfulFields：视为低置信度，继续尝试后面的模型</li>
 * </ul>
 *
 * 冷却表可能被并发处理的多个文档同时写入，后写覆盖先写即可。
 *
 * @author housing-ocr
 * @since 2025-01-12
 */
@Slf4j
@Service
public class PropertyExtractionServiceImpl implements PropertyExtractionService {

    private static final String BUILD_YEAR_FIELD = "build_year";

    private static final String PROMPT_TEMPLATE = """
        Extract structured information from following Japanese real estate document.

        Text content:
        {ocr_text}

        Fields to extract:
        1. property_type: Property type (マンション/一戸建て/土地 etc.)
        2. property_name: Property name
        3. address: Full address including room number
        4. prefecture: Prefecture (東京都/大阪府 etc.)
        5. city: City/District (渋谷区/大阪市 etc.)
        6. land_rights: Land rights (所有権/借地権 etc.)
        7. current_status: Current status (空室/居住中 etc.)
        8. handover_date: Handover date
        9. build_year: Year built (Western calendar, e.g., 2015)
        10. structure: Structure (RC造/木造/S造 etc.)
        11. total_floors: Total floors
        12. floor_number: Floor number
        13. room_layout: Room layout (1LDK/2LDK/3LDK etc.)
        14. orientation: Orientation (南/北/東/西 etc.)
        15. price: Price in 万円 (e.g., 5000)
        16. management_fee: Monthly management fee in 円
        17. repair_fee: Monthly repair fund in 円
        18. exclusive_area: Exclusive area in m²
        19. balcony_area: Balcony area in m² (if available)
        20. stations: Array of nearest stations reachable on foot. Each item: name, lines (array of line names), \
        walking_minutes. Merge multiple lines of the same station into ONE item.
        21. parking: Parking availability
        22. pet_policy: Pet policy
        23. corner_room: Whether it's a corner room (角部屋). Set to null if not mentioned

        Important:
        - Convert units: 畳→m²(×1.62), 坪→m²(×3.3)
        - Set null if field is not found
        - stations: ONLY include walking distance (徒歩/歩). EXCLUDE 直通/乗換/バス/電車 or other transport
        - Return ONLY JSON, no other text
        - Ensure valid JSON format

        Example response:
        {
            "property_type": "マンション",
            "address": "東京都渋谷区円山町28-14 305",
            "price": 5800,
            "exclusive_area": 65.8,
            "room_layout": "2LDK",
            "build_year": 2018,
            "stations": [
                {"name": "渋谷", "lines": ["山手線", "銀座線", "半蔵門線"], "walking_minutes": 5}
            ],
            "parking": "空無 (月額23,000円/台)"
        }
        """;

    private final RestTemplate restTemplate;
    private final LlmProperties llmProperties;
    private final ModelCandidateService modelCandidateService;
    private final Clock clock;

    /**
     * 模型 → 最近一次 429 的时间
     */
    private final Map<String, Instant> rateLimitedAt = new ConcurrentHashMap<>();

    @Autowired
    public PropertyExtractionServiceImpl(@Qualifier("llmRestTemplate") RestTemplate restTemplate,
                                         LlmProperties llmProperties,
                                         ModelCandidateService modelCandidateService) {
        this(restTemplate, llmProperties, modelCandidateService, Clock.systemUTC());
    }

    PropertyExtractionServiceImpl(RestTemplate restTemplate,
                                  LlmProperties llmProperties,
                                  ModelCandidateService modelCandidateService,
                                  Clock clock) {
        this.restTemplate = restTemplate;
        this.llmProperties = llmProperties;
        this.modelCandidateService = modelCandidateService;
        this.clock = clock;
    }

    @Override
    public Map<String, Object> extractProperties(String ocrText, Long documentId) {
        // 每次调用都读取最新列表，运行时的增删改立即生效
        List<String> models = modelCandidateService.getCandidates();
        if (models.isEmpty()) {
            throw new CandidatesExhaustedException("没有可用的模型，请先添加候选模型", models);
        }
        log.info("LLM提取中: documentId={}, length={}, candidates={}", documentId, ocrText.length(), models);

        String prompt = PROMPT_TEMPLATE.replace("{ocr_text}", ocrText);
        List<String> attempted = new ArrayList<>();

        for (String model : models) {
            if (isInCooldown(model)) {
                log.info("模型冷却中，跳过: documentId={}, model={}, remaining={}s",
                    documentId, model, cooldownRemaining(model).toSeconds());
                continue;
            }
            attempted.add(model);

            try {
                Map<String, Object> properties = LLMJsonUtils.parseObject(callModel(model, prompt));
                JapaneseEraUtils.normalizeYearField(properties, BUILD_YEAR_FIELD);

                int meaningful = countMeaningfulFields(properties);
                if (meaningful < llmProperties.getMinMeaningfulFields()) {
                    log.info("有效字段不足，尝试下一个模型: documentId={}, model={}, fields={}",
                        documentId, model, meaningful);
                    continue;
                }

                properties.put(EXTRACTED_BY_MODEL_KEY, model);
                log.info("LLM提取成功: documentId={}, model={}, fields={}", documentId, model, meaningful);
                return properties;
            } catch (HttpStatusCodeException e) {
                if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                    rateLimitedAt.put(model, clock.instant());
                    log.warn("模型触发速率限制，进入冷却: documentId={}, model={}", documentId, model);
                } else {
                    log.warn("模型HTTP错误: documentId={}, model={}, status={}",
                        documentId, model, e.getStatusCode().value());
                }
            } catch (RestClientException e) {
                log.warn("模型调用失败: documentId={}, model={}, error={}", documentId, model, e.getMessage());
            } catch (BusinessException e) {
                log.warn("模型响应解析失败: documentId={}, model={}, error={}", documentId, model, e.getMessage());
            }
        }

        throw new CandidatesExhaustedException("所有模型均失败，已尝试: " + String.join(", ", attempted), attempted);
    }

    @Override
    public boolean isInCooldown(String model) {
        return !cooldownRemaining(model).isZero();
    }

    private Duration cooldownRemaining(String model) {
        Instant last = rateLimitedAt.get(model);
        if (last == null) {
            return Duration.ZERO;
        }
        Duration remaining = llmProperties.getRateLimitCooldown().minus(Duration.between(last, clock.instant()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private String callModel(String model, String prompt) {
        Map<String, Object> payload = Map.of(
            "model", model,
            "messages", List.of(Map.of("role", "user", "content", prompt)),
            "temperature", llmProperties.getTemperature(),
            "max_tokens", llmProperties.getMaxTokens()
        );

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StrUtil.isNotBlank(llmProperties.getApiKey())) {
            headers.setBearerAuth(llmProperties.getApiKey());
        }
        headers.set("HTTP-Referer", llmProperties.getReferer());
        headers.set("X-Title", llmProperties.getTitle());

        JsonNode response = restTemplate.postForObject(llmProperties.getEndpoint(), new HttpEntity<>(payload, headers), JsonNode.class);
        if (response == null) {
            throw new BusinessException("LLM 响应为空");
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new BusinessException("LLM 响应缺少 message.content");
        }
        return content.asText();
    }

    /**
     * 统计有值字段，内部字段（下划线开头）不计入
     */
    static int countMeaningfulFields(Map<String, Object> properties) {
        int count = 0;
        for (Map.Entry<String, Object> entry : properties.entrySet()) {
            if (entry.getKey().startsWith("_")) {
                continue;
            }
            Object value = entry.getValue();
            if (value == null
                || (value instanceof String text && StrUtil.isBlank(text))
                || (value instanceof Collection<?> collection && collection.isEmpty())
                || (value instanceof Map<?, ?> map && map.isEmpty())) {
                continue;
            }
            count++;
        }
        return count;
    }
}
