package com.tablehub.combatservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * combat-service 启动入口。
 * 负责战斗状态机、濒死检定规则、以及按受众分组的实时广播。
 */
@SpringBootApplication
public class CombatServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CombatServiceApplication.class, args);
    }
}
