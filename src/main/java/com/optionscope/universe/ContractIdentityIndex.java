package com.optionscope.universe;

import com.optionscope.loader.DatasetCategory.Columns;
import com.optionscope.loader.RawRow;
import com.optionscope.loader.RawTable;
import com.optionscope.utils.Values;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that every contract id keeps one description across all raw observations. Reports, never
 * mutates; null descriptions are not counted as a distinct value.
 */
public final class ContractIdentityIndex {
    private static final Logger LOG = LogManager.getLogger(ContractIdentityIndex.class);

    public IdentityReport check(List<RawTable> tables) {
        Map<String, Set<String>> descriptions = new LinkedHashMap<>();
        Map<String, Set<String>> files = new LinkedHashMap<>();
        for (RawTable table : tables) {
            for (RawRow row : table.rows()) {
                String id = Values.text(row.get(Columns.ID));
                if (id == null) {
                    continue;
                }
                Set<String> seen = descriptions.computeIfAbsent(id, ignored -> new LinkedHashSet<>());
                Set<String> sources = files.computeIfAbsent(id, ignored -> new LinkedHashSet<>());
                String description = Values.text(row.get(Columns.DESCRIPTION));
                if (description != null && seen.add(description)) {
                    sources.add(row.sourceFile);
                }
            }
        }

        List<IdentityViolation> violations = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : descriptions.entrySet()) {
            if (entry.getValue().size() > 1) {
                violations.add(new IdentityViolation(entry.getKey(), entry.getValue(), files.get(entry.getKey())));
            }
        }
        IdentityReport report = new IdentityReport(descriptions.size(), violations);
        if (report.isClean()) {
            LOG.info("Identity check: ids={} violations=0", report.checkedIds);
        } else {
            LOG.warn("Identity check: ids={} violations={}", report.checkedIds, report.violationCount());
            for (IdentityViolation violation : violations) {
                LOG.warn("  id={} descriptions={} files={}",
                        violation.contractId(), violation.descriptions(), violation.sourceFiles());
            }
        }
        return report;
    }
}
