package com.lingshield.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lingshield.core.exception.AuditExportException;
import com.lingshield.core.util.JsonSupport;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 审计数据导出
 * <p>
 * JSON 保留完整结构；CSV 与 XML 将每条记录展平为一行，嵌套值以 JSON 文本写入单元格。
 */
class AuditExporter {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper json = JsonSupport.mapper();
    private final CsvMapper csv = CsvMapper.builder().build();
    private final XmlMapper xml = XmlMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    byte[] export(ExportKind kind, ExportFormat format, Object data) {
        try {
            switch (format) {
                case JSON:
                    return json.writerWithDefaultPrettyPrinter().writeValueAsBytes(data);
                case CSV:
                    return toCsv(rows(data));
                case XML:
                    return xml.writer()
                            .withRootName(kind.name().toLowerCase(Locale.ROOT))
                            .writeValueAsBytes(rows(data));
                default:
                    throw new AuditExportException("Unsupported export format: " + format);
            }
        } catch (JsonProcessingException e) {
            throw new AuditExportException("Failed to export " + kind + " as " + format, e);
        }
    }

    private byte[] toCsv(List<Map<String, Object>> rows) throws JsonProcessingException {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);
        return csv.writer(schema.build()).writeValueAsBytes(rows);
    }

    /**
     * 展平为行：顶层属性保留，嵌套对象与集合转为 JSON 文本
     */
    private List<Map<String, Object>> rows(Object data) throws JsonProcessingException {
        Collection<?> items = data instanceof Collection ? (Collection<?>) data : List.of(data);
        List<Map<String, Object>> rows = new ArrayList<>(items.size());
        for (Object item : items) {
            Map<String, Object> source = json.convertValue(item, ROW_TYPE);
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                Object value = entry.getValue();
                if (value instanceof Map || value instanceof Collection) {
                    row.put(entry.getKey(), json.writeValueAsString(value));
                } else {
                    row.put(entry.getKey(), value == null ? "" : value);
                }
            }
            rows.add(row);
        }
        return rows;
    }
}
