package com.optionscope.universe;

import com.optionscope.loader.DatasetCategory;
import com.optionscope.loader.RawTable;
import com.optionscope.testing.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContractIdentityIndexTest {

    private final ContractIdentityIndex index = new ContractIdentityIndex();

    @Test
    void check_shouldReportIdsWithSeveralDescriptionsAcrossTables() {
        RawTable optionSpace = Fixtures.optionSpace(
                "O1,AAPL 150 C,,,2024-01-19,Call,150,S1",
                "O2,AAPL 150 P,,,2024-01-19,Put,150,S1");
        RawTable details = Fixtures.table(DatasetCategory.STOCK_OPTION, "stock_option_1.csv",
                "id,description",
                "O1,AAPL 150 CALL",
                "O2,AAPL 150 P");

        IdentityReport report = index.check(List.of(optionSpace, details));

        assertEquals(2, report.checkedIds);
        assertEquals(1, report.violationCount());
        IdentityViolation violation = report.violations.get(0);
        assertEquals("O1", violation.contractId());
        assertEquals(Set.of("AAPL 150 C", "AAPL 150 CALL"), violation.descriptions());
        assertEquals(Set.of("option_space_1.csv", "stock_option_1.csv"), violation.sourceFiles());
    }

    @Test
    void check_shouldIgnoreMissingDescriptions() {
        RawTable optionSpace = Fixtures.optionSpace(
                "O1,AAPL 150 C,,,2024-01-19,Call,150,S1",
                "O1,,,,2024-01-19,Call,150,S1");

        IdentityReport report = index.check(List.of(optionSpace));

        assertTrue(report.isClean());
    }

    @Test
    void check_shouldBeCleanForEmptyInput() {
        IdentityReport report = index.check(List.of(RawTable.empty(DatasetCategory.STOCK_OPTION)));

        assertTrue(report.isClean());
        assertEquals(0, report.checkedIds);
    }

    @Test
    void exception_shouldNameOffendingIds() {
        IdentityReport report = new IdentityReport(3, List.of(
                new IdentityViolation("O9", Set.of("a", "b"), Set.of("f.csv"))));

        IdentityViolationException e = new IdentityViolationException(report);

        assertTrue(e.getMessage().startsWith("1 contract id(s)"));
        assertTrue(e.getMessage().contains("O9"));
    }
}
