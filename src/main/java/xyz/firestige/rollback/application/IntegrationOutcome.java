package xyz.firestige.rollback.application;

/**
 * 规则触发 rollback 动作后集成层的处理结果
 */
public enum IntegrationOutcome {

    /** 已提交回滚 */
    SUBMITTED,

    /** 同一部署已有进行中的回滚，本次为空操作 */
    DEDUPLICATED,

    /** 自动回滚已关闭，降级为告警 */
    AUTO_ROLLBACK_DISABLED,

    /** 需要人工审批，只发送审批告警 */
    APPROVAL_REQUIRED,

    /** 编排器拒绝（目标配置无效等） */
    REJECTED,

    /** 非 rollback 动作 */
    IGNORED
}
