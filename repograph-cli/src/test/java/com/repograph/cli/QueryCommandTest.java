package com.repograph.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link QueryCommand}.
 */
class QueryCommandTest extends CliTestBase {

    @Test
    void query_incoming_listsDependents() {
        int exitCode = execute("query", fixture("typescript-app").toString(), "--file", "src/utils.ts", "-d", "in");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
            "src/components/Button.tsx -> src/utils.ts [import] line 1 (../utils)",
            "src/index.ts -> src/utils.ts [import] line 1 (./utils)");
    }

    @Test
    void query_outgoing_listsDependencies() {
        int exitCode = execute("query", fixture("typescript-app").toString(), "--file", "src/index.ts", "--direction", "OUT");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("src/index.ts -> src/utils.ts [import] line 1 (./utils)");
    }

    @Test
    void query_fileWithoutRelationships_saysSo() {
        int exitCode = execute("query", fixture("typescript-app").toString(), "--file", "src/utils.ts", "-d", "out");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("No relationships found for src/utils.ts");
    }

    @Test
    void query_withoutFileOption_isUsageError() {
        int exitCode = execute("query", fixture("typescript-app").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--file");
    }
}
