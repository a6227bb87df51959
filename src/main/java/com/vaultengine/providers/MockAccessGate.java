package com.vaultengine.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory roles and operator approvals, seeded from configuration.
 *
 * In production, this would query the host's access-control registry.
 */
@Component
@Slf4j
public class MockAccessGate implements AccessGate {

    private final Map<VaultRole, Set<String>> roles = new EnumMap<>(VaultRole.class);

    // controller -> approved operators
    private final Map<String, Set<String>> operators = new ConcurrentHashMap<>();

    public MockAccessGate(
            @Value("${vault-engine.access.operators:}") List<String> operatorAccounts,
            @Value("${vault-engine.access.fee-managers:}") List<String> feeManagerAccounts) {
        for (VaultRole role : VaultRole.values()) {
            roles.put(role, ConcurrentHashMap.newKeySet());
        }
        operatorAccounts.forEach(account -> grantRole(VaultRole.OPERATOR, account));
        feeManagerAccounts.forEach(account -> grantRole(VaultRole.FEE_MANAGER, account));
    }

    @Override
    public boolean isAuthorized(String controller, String caller) {
        if (controller == null || caller == null) {
            return false;
        }
        if (controller.equals(caller)) {
            return true;
        }
        return operators.getOrDefault(controller, Set.of()).contains(caller);
    }

    @Override
    public boolean hasRole(VaultRole role, String caller) {
        return caller != null && roles.get(role).contains(caller);
    }

    public void grantRole(VaultRole role, String account) {
        if (account == null || account.isBlank()) {
            return;
        }
        roles.get(role).add(account.trim());
        log.info("Granted {} to {}", role, account);
    }

    /**
     * Approve or revoke {@code operator} as a delegate of {@code controller}.
     */
    public void setOperator(String controller, String operator, boolean approved) {
        Set<String> approvedOperators = operators.computeIfAbsent(controller, k -> ConcurrentHashMap.newKeySet());
        if (approved) {
            approvedOperators.add(operator);
        } else {
            approvedOperators.remove(operator);
        }
        log.info("Operator {} for controller {} set to {}", operator, controller, approved);
    }
}
