package org.csits.kex.manager.storage;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.io.FilenameUtils;

/**
 * 按文件扩展名推断 Content-Type。
 */
public final class MimeTypeResolver {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private static final Map<String, String> CONTENT_TYPES = new HashMap<>();

    static {
        CONTENT_TYPES.put("json", "application/json");
        CONTENT_TYPES.put("csv", "text/csv");
        CONTENT_TYPES.put("txt", "text/plain");
        CONTENT_TYPES.put("xml", "application/xml");
        CONTENT_TYPES.put("yaml", "application/x-yaml");
        CONTENT_TYPES.put("yml", "application/x-yaml");
        CONTENT_TYPES.put("xls", "application/vnd.ms-excel");
        CONTENT_TYPES.put("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
        CONTENT_TYPES.put("zip", "application/zip");
        CONTENT_TYPES.put("gz", "application/gzip");
        CONTENT_TYPES.put("tar", "application/x-tar");
    }

    private MimeTypeResolver() {
    }

    public static String resolveContentType(String fileName) {
        if (fileName == null) {
            return DEFAULT_CONTENT_TYPE;
        }
        String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        return CONTENT_TYPES.getOrDefault(extension, DEFAULT_CONTENT_TYPE);
    }
}
