package xyz.firestige.rollback.infrastructure.health;

/**
 * rollback 动作的接收方（集成层实现）
 */
@FunctionalInterface
public interface RollbackRuleHandler {

    void onRuleFired(RuleFiring firing);
}
