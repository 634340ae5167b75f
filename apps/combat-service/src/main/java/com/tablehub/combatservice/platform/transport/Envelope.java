package com.tablehub.combatservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（所有推送共用）
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：kind / event / campaignId / payload / ts / seq
 * - 客户端只需按 event 分发，不再依赖“位置参数”的顺序
 *
 * 用法示例：
 *   Envelope<TurnAdvancedPayload> msg = Envelope.event("TurnAdvanced", campaignId, payload, version);
 *   Envelope<CommandResult>       err = Envelope.error(campaignId, result);
 */
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    /** 消息类别：STATE=完整快照，EVENT=增量事件，ERROR=错误通知 */
    public enum Kind { STATE, EVENT, ERROR }

    private final Kind kind;
    private final String event;      // CombatStarted / TurnAdvanced ...；STATE/ERROR 时为固定值
    private final String campaignId;
    private final T payload;
    private final long ts;           // 服务器时间戳（ms）
    private final long seq;          // 遭遇战 version；与战斗无关的事件为 0

    private Envelope(Kind kind, String event, String campaignId, T payload, long ts, long seq) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.event = Objects.requireNonNull(event, "event");
        this.campaignId = campaignId;    // 只有 ERROR 可能为空（请求本身无法识别战役）
        this.payload = payload;
        this.ts = ts;
        this.seq = seq;
    }

    public static <T> Envelope<T> of(Kind kind, String event, String campaignId, T payload, long seq) {
        return new Envelope<>(kind, event, campaignId, payload, Instant.now().toEpochMilli(), seq);
    }

    /** 完整快照（断线重连后拉取） */
    public static <T> Envelope<T> state(String campaignId, T payload, long seq) {
        return of(Kind.STATE, "FullSync", campaignId, payload, seq);
    }

    /** 增量事件 */
    public static <T> Envelope<T> event(String event, String campaignId, T payload, long seq) {
        return of(Kind.EVENT, event, campaignId, payload, seq);
    }

    /** 错误通知 */
    public static <T> Envelope<T> error(String campaignId, T payload) {
        return of(Kind.ERROR, "Error", campaignId, payload, 0);
    }

    // Getters（不可变对象，无 setters）
    public Kind getKind()         { return kind; }
    public String getEvent()      { return event; }
    public String getCampaignId() { return campaignId; }
    public T getPayload()         { return payload; }
    public long getTs()           { return ts; }
    public long getSeq()          { return seq; }

    @Override public String toString() {
        return "Envelope{" +
                "kind=" + kind +
                ", event='" + event + '\'' +
                ", campaignId='" + campaignId + '\'' +
                ", ts=" + ts +
                ", seq=" + seq +
                '}';
    }
}
