package com.tablehub.combatservice.engine.core;

/**
 * 可复制的状态对象。
 * - 仓储层读出后交给业务层“在内存中修改、最后一次性保存”；
 * - 内存实现（如测试用仓储）借助 copy() 隔离调用方的就地修改。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝。
     */
    GameState copy();
}
