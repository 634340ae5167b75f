package com.tablehub.combatservice.engine.core;

/**
 * 统一的“外部输入指令”抽象。
 * - DM 界面操作、模型工具调用，最终都被解析成某个 Command 实现；
 * - 命令集合是封闭的：调度层只认识已声明的类型，不再向下传递任意 Map；
 * - name() 与工具调用名保持一致（snake_case），用于日志与错误提示。
 */
public interface Command {

    String name();
}
