package xyz.firestige.rollback.infrastructure.external;

/**
 * 通知渠道（尽力而为，不保证送达）
 */
public interface NotificationChannel {

    /**
     * @return true=发送成功
     */
    boolean send(String channel, String message);
}
