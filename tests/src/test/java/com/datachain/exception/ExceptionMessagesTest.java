package com.datachain.exception;

import com.datachain.logical.SqlQuery;
import com.datachain.test.TestBase;
import com.datachain.test.TestCategories;
import com.datachain.validation.ErrorCode;
import com.datachain.validation.ErrorStage;
import com.datachain.validation.QueryError;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for user-facing and technical messages of the compiler's exceptions.
 */
@TestCategories.Unit
@DisplayName("Exception Message Tests")
public class ExceptionMessagesTest extends TestBase {

    @Nested
    @DisplayName("QueryExecutionException")
    class Execution {

        @Test
        @DisplayName("Missing column is explained")
        void testMissingColumn() {
            QueryExecutionException e = new QueryExecutionException(
                "Binder Error: Referenced column \"revenu\" not found in FROM clause!", "SELECT revenu FROM orders");

            assertThat(e.getUserMessage()).isEqualTo(
                "Column 'revenu' does not exist in the database. Check the semantic model column names.");
            assertThat(e.getFailedSQL()).isEqualTo("SELECT revenu FROM orders");
        }

        @Test
        @DisplayName("Missing table is explained")
        void testMissingTable() {
            QueryExecutionException e = new QueryExecutionException(
                "Catalog Error: Table with name orders does not exist!", "SELECT * FROM orders");

            assertThat(e.getUserMessage()).startsWith("Table orders does not exist in the database.");
        }

        @Test
        @DisplayName("Conversion and unknown errors")
        void testOtherErrors() {
            assertThat(new QueryExecutionException("Conversion Error: Could not convert string 'x'", "q")
                .getUserMessage()).startsWith("Data type mismatch");
            assertThat(new QueryExecutionException("IO Error: disk full", "q").getUserMessage())
                .isEqualTo("Query execution failed: IO Error: disk full");
        }

        @Test
        @DisplayName("Technical message includes SQL and cause")
        void testTechnicalMessage() {
            QueryExecutionException e = new QueryExecutionException("boom", new SQLException("driver says no"), "SELECT 1");

            assertThat(e.getTechnicalMessage())
                .contains("Error: boom")
                .contains("SQL: SELECT 1")
                .contains("Cause: SQLException: driver says no");
        }
    }

    @Nested
    @DisplayName("SQLGenerationException")
    class Generation {

        @Test
        @DisplayName("Flat query failure message")
        void testFlat() {
            SqlQuery query = SqlQuery.from("orders").build();
            SQLGenerationException e = new SQLGenerationException("bad node", query);

            assertThat(e.getUserMessage()).isEqualTo("Failed to generate SQL: bad node");
            assertThat(e.getTechnicalMessage()).contains("Query: " + query);
        }

        @Test
        @DisplayName("Cause is reported in the technical message")
        void testCause() {
            SQLGenerationException e = new SQLGenerationException("wrapped", new IllegalStateException("inner"), null);

            assertThat(e.getFailedQuery()).isNull();
            assertThat(e.getTechnicalMessage()).contains("Cause: inner").doesNotContain("Query:");
        }
    }

    @Nested
    @DisplayName("Model and Resolution Exceptions")
    class ModelAndResolution {

        @Test
        @DisplayName("Single violation uses singular wording")
        void testSingleViolation() {
            SemanticModelException e = new SemanticModelException(List.of("Duplicate table 'a'"));

            assertThat(e.getMessage()).isEqualTo("Invalid semantic model (1 violation):\n  - Duplicate table 'a'");
        }

        @Test
        @DisplayName("Resolution failure converts to a query error")
        void testResolutionError() {
            QueryResolutionException e = new QueryResolutionException("Cannot resolve KPI 'x'");

            assertThat(e.getError()).isEqualTo(
                QueryError.of(ErrorStage.RESOLUTION, ErrorCode.UNRESOLVED_REFERENCE, "Cannot resolve KPI 'x'"));
            assertThat(e.getError().toString()).isEqualTo("[resolution/unresolved_reference] Cannot resolve KPI 'x'");
        }

        @Test
        @DisplayName("Duplicate entity reports the match count")
        void testDuplicateEntity() {
            DuplicateEntityException e = new DuplicateEntityException("filter", "f", 3);

            assertThat(e.getMessage()).isEqualTo("3 matching filter entries named 'f'");
            assertThat(e.getEntityKind()).isEqualTo("filter");
            assertThat(e.getEntityName()).isEqualTo("f");
        }
    }
}
