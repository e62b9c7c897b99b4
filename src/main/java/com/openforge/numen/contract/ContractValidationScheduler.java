package com.openforge.numen.contract;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background sweep over all tenants. Off unless
 * {@code agent.contract.validation.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "agent.contract.validation", name = "enabled", havingValue = "true")
public class ContractValidationScheduler {

    private final ContractValidator  validator;
    private final ContractProperties properties;

    @Scheduled(cron = "${agent.contract.validation.cron:0 0 * * * *}")
    public void sweep() {
        ValidationReport.Summary summary = validator.validateAll(null, properties.validation().autoRepair());
        if (summary.failed() > 0) {
            log.warn("[Validator] Scheduled sweep left {} agent(s) inconsistent: {}",
                    summary.failed(), summary.failedAgents());
        }
    }
}
