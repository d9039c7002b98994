package com.tactics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Engine-wide beans built from {@code tactics.*} properties.
 */
@Configuration
public class EngineConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder().build();
    }

    @Bean
    public EngineSettings engineSettings(
            @Value("${tactics.engine.max-turns:5}") int maxTurns,
            @Value("${tactics.engine.max-steps:10000}") int maxSteps,
            @Value("${tactics.engine.charge-max-distance:12}") int chargeMaxDistance,
            @Value("${tactics.engine.check-invariants:true}") boolean checkInvariants) {
        return new EngineSettings(maxTurns, maxSteps, chargeMaxDistance, checkInvariants);
    }

    @Bean
    public RewardSettings rewardSettings(
            @Value("${tactics.rewards.move:0.0}") double move,
            @Value("${tactics.rewards.pass:-0.1}") double pass,
            @Value("${tactics.rewards.hit:0.2}") double hit,
            @Value("${tactics.rewards.damage-point:0.5}") double damagePoint,
            @Value("${tactics.rewards.kill:3.0}") double kill,
            @Value("${tactics.rewards.charge-success:0.5}") double chargeSuccess,
            @Value("${tactics.rewards.charge-failed:-0.2}") double chargeFailed,
            @Value("${tactics.rewards.illegal-action:-1.0}") double illegalAction,
            @Value("${tactics.rewards.win:10.0}") double win,
            @Value("${tactics.rewards.loss:-10.0}") double loss,
            @Value("${tactics.rewards.draw:0.0}") double draw) {
        return new RewardSettings(move, pass, hit, damagePoint, kill, chargeSuccess, chargeFailed,
                illegalAction, win, loss, draw);
    }
}
