package com.tablehub.combatservice.platform.notify;

import com.tablehub.combatservice.platform.transport.Envelope;

/**
 * 分组推送原语。实现方负责吞掉并记录投递失败，不向调用方抛出。
 */
public interface HubTransport {

    void sendToGroup(String group, Envelope<?> envelope);
}
