package com.housingocr.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.housingocr.model.entity.DocumentDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * 文档 Mapper
 *
 * @author housing-ocr
 */
@Mapper
public interface DocumentMapper extends BaseMapper<DocumentDO> {
}
