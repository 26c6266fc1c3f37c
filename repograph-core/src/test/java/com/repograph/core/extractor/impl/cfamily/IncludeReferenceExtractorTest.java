package com.repograph.core.extractor.impl.cfamily;

import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link IncludeReferenceExtractor}.
 */
class IncludeReferenceExtractorTest {

    private final IncludeReferenceExtractor extractor = new IncludeReferenceExtractor();

    @Test
    void extract_withQuotedAndAngleIncludes_treatsBothAlike() {
        String content = """
            #include "utils/helpers.h"
            #include <stdio.h>
              #  include "local.h"
            int main(void) { return 0; }
            """;

        List<RawReference> references = extractor.extract("src/main.c", content);

        assertThat(references)
            .extracting(RawReference::text)
            .containsExactly("utils/helpers.h", "stdio.h", "local.h");
        assertThat(references).allMatch(ref -> ref.kind() == ReferenceKind.INCLUDE);
    }

    @Test
    void extract_withUnterminatedInclude_ignoresLine() {
        assertThat(extractor.extract("a.c", "#include \"broken.h\n#include <also")).isEmpty();
    }
}
