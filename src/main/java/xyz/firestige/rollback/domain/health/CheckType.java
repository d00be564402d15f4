package xyz.firestige.rollback.domain.health;

import java.util.Arrays;

/**
 * 健康检查类型
 */
public enum CheckType {

    HTTP_RESPONSE("http_response"),

    DATABASE_CONNECTION("database_connection"),

    SYSTEM_RESOURCE("system_resource"),

    CUSTOM("custom");

    private final String code;

    CheckType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static CheckType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的检查类型: " + code));
    }
}
