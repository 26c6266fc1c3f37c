package com.repograph.core.resolver.impl.java;

import com.repograph.core.resolver.ReferenceResolver;
import com.repograph.core.resolver.ResolverTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JavaReferenceResolver}.
 */
class JavaReferenceResolverTest extends ResolverTestBase {

    private final JavaReferenceResolver resolver = new JavaReferenceResolver();

    @Override
    protected ReferenceResolver resolver() {
        return resolver;
    }

    @Test
    void resolve_duplicateSimpleNames_prefersMatchingPackagePath() {
        // Given: another User.java comes first in traversal order
        givenFiles(
            "legacy/User.java",
            "src/main/java/com/example/model/User.java",
            "src/main/java/com/example/App.java"
        );

        // When / Then
        assertThat(resolve("com.example.model.User", "src/main/java/com/example/App.java"))
            .contains("src/main/java/com/example/model/User.java");
    }

    @Test
    void resolve_packageLayoutDiffers_fallsBackToFileName() {
        givenFiles("App.java", "lib/Helper.java");

        assertThat(resolve("com.other.Helper", "App.java")).contains("lib/Helper.java");
    }

    @Test
    void resolve_staticMemberImport_resolvesEnclosingClass() {
        givenFiles("src/com/example/util/Strings.java", "src/com/example/App.java");

        assertThat(resolve("com.example.util.Strings.join", "src/com/example/App.java"))
            .contains("src/com/example/util/Strings.java");
    }

    @Test
    void resolve_jdkClass_returnsEmpty() {
        givenFiles("src/App.java");

        assertThat(resolve("java.util.List", "src/App.java")).isEmpty();
    }

    @Test
    void resolve_lowercaseEnclosingSegment_isNotTreatedAsClass() {
        givenFiles("src/App.java", "src/example.java");

        assertThat(resolve("com.example.Missing", "src/App.java")).isEmpty();
    }

    @Test
    void resolve_sameNamedClassElsewhere_fallsBackToReferencingFile() {
        // Given: the only User.java is the referencing file
        givenFiles("src/com/example/User.java");

        assertThat(resolve("com.other.User", "src/com/example/User.java")).contains("src/com/example/User.java");
    }
}
