package com.repograph.core.extractor.impl.java;

import com.repograph.core.model.RawReference;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JavaReferenceExtractor}.
 */
class JavaReferenceExtractorTest {

    private final JavaReferenceExtractor extractor = new JavaReferenceExtractor();

    @Test
    void extract_withRegularAndStaticImports_extractsQualifiedNames() {
        String content = """
            package com.example.service;

            import com.example.model.User;
            import static com.example.util.Strings.join;
            import java.util.*;

            public class UserService {}
            """;

        List<RawReference> references = extractor.extract("src/main/java/com/example/service/UserService.java", content);

        assertThat(references)
            .extracting(RawReference::text)
            .containsExactly("com.example.model.User", "com.example.util.Strings.join");
        assertThat(references.get(0).lineNumber()).isEqualTo(3);
    }

    @Test
    void extract_withoutImports_returnsEmptyList() {
        assertThat(extractor.extract("A.java", "class A { String importantField; }")).isEmpty();
    }
}
