package xyz.firestige.rollback.domain.health;

import java.util.Arrays;

/**
 * 规则触发后的动作
 */
public enum RuleAction {

    /**
     * 发送告警（尽力而为，失败只记日志）
     */
    ALERT("alert"),

    /**
     * 交给集成层构造回滚触发器
     */
    ROLLBACK("rollback"),

    /**
     * 保全日志
     */
    PRESERVE_LOGS("preserve_logs");

    private final String code;

    RuleAction(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static RuleAction fromCode(String code) {
        return Arrays.stream(values())
                .filter(a -> a.code.equalsIgnoreCase(code) || a.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的规则动作: " + code));
    }
}
