package com.tablehub.combatservice.games.combat.domain.dto;

/**
 * 开战时的一名队伍成员：引用名册中的角色。
 *
 * @param characterId 名册角色 id
 * @param initiative  已掷好的先攻；为 null 时由服务端掷 d20 + 调整值
 * @param surprised   是否被突袭（仍在先攻表中，只跳过首轮行动）
 */
public record PartyInitiative(String characterId, Integer initiative, boolean surprised) {
}
