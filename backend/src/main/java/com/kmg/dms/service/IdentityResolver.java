package com.kmg.dms.service;

import com.kmg.dms.model.Employee;
import com.kmg.dms.model.Tenant;
import com.kmg.dms.repo.EmployeeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a decoded personnel number to an employee record.
 * <p>
 * Candidate identifiers are tried in a fixed order: the raw id, {@code hint_raw}, {@code tenantCode_raw} with the
 * tenant code's leading zeros stripped, {@code 1_raw} to {@code 5_raw}, and for numeric ids the zero-stripped and the
 * 8-digit zero-padded form. The whole chain runs against the tenant's employees first and then against the
 * tenant-less legacy records. The first hit wins.
 */
@Service
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final List<String> LEGACY_TENANT_PREFIXES = List.of("1", "2", "3", "4", "5");

    private final EmployeeRepository employeeRepository;

    public IdentityResolver(EmployeeRepository employeeRepository) {
        this.employeeRepository = employeeRepository;
    }

    public Optional<Employee> resolve(String rawId, Tenant tenant, String tenantHint) {
        if (rawId == null || rawId.isBlank()) {
            return Optional.empty();
        }
        List<String> candidates = candidates(rawId.strip(), tenant, tenantHint);

        if (tenant != null) {
            Optional<Employee> scoped = firstMatch(tenant.id(), candidates);
            if (scoped.isPresent()) {
                return scoped;
            }
        }
        Optional<Employee> legacy = firstMatch(null, candidates);
        if (legacy.isEmpty()) {
            log.debug("No employee for id {} (tenant {}, hint {})", rawId,
                    tenant == null ? "-" : tenant.code(), tenantHint);
        }
        return legacy;
    }

    static List<String> candidates(String rawId, Tenant tenant, String tenantHint) {
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(rawId);
        if (tenantHint != null && !tenantHint.isBlank()) {
            ordered.add(tenantHint.strip() + "_" + rawId);
        }
        if (tenant != null && tenant.code() != null && !tenant.code().isBlank()) {
            String stripped = stripLeadingZeros(tenant.code());
            ordered.add((stripped.isEmpty() ? "1" : stripped) + "_" + rawId);
        }
        for (String prefix : LEGACY_TENANT_PREFIXES) {
            ordered.add(prefix + "_" + rawId);
        }
        if (rawId.chars().allMatch(Character::isDigit)) {
            String stripped = stripLeadingZeros(rawId);
            if (!stripped.isEmpty()) {
                ordered.add(stripped);
            }
            if (rawId.length() < 8) {
                ordered.add("0".repeat(8 - rawId.length()) + rawId);
            }
        }
        return new ArrayList<>(ordered);
    }

    private Optional<Employee> firstMatch(String tenantId, List<String> candidates) {
        for (String candidate : candidates) {
            Optional<Employee> employee = employeeRepository.findByIdentifier(tenantId, candidate);
            if (employee.isPresent()) {
                return employee;
            }
        }
        return Optional.empty();
    }

    private static String stripLeadingZeros(String value) {
        int index = 0;
        while (index < value.length() && value.charAt(index) == '0') {
            index++;
        }
        return value.substring(index);
    }
}
