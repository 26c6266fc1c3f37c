package com.repograph.core.extractor.impl.javascript;

import com.repograph.core.model.RawReference;
import com.repograph.core.model.ReferenceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link JavaScriptReferenceExtractor}.
 */
class JavaScriptReferenceExtractorTest {

    private JavaScriptReferenceExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new JavaScriptReferenceExtractor();
    }

    @Test
    void extract_withAllImportForms_extractsEachSpecifier() {
        // Given: every supported import form
        String content = """
            import { helper } from './utils';
            import './styles.css';
            const fs = require('fs'); const x = require("./x");
            const lazy = import('./lazy');
            """;

        // When
        List<RawReference> references = extractor.extract("src/index.ts", content);

        // Then
        assertThat(references)
            .extracting(RawReference::text, RawReference::lineNumber, RawReference::kind)
            .containsExactly(
                tuple("./utils", 1, ReferenceKind.IMPORT),
                tuple("./styles.css", 2, ReferenceKind.IMPORT),
                tuple("fs", 3, ReferenceKind.IMPORT),
                tuple("./x", 3, ReferenceKind.IMPORT),
                tuple("./lazy", 4, ReferenceKind.IMPORT)
            );
        assertThat(references).allMatch(ref -> ref.sourceFile().equals("src/index.ts"));
    }

    @Test
    void extract_withReExports_extractsExportReferences() {
        String content = """
            export * from './all';
            export { a, b } from "./named";
            export type { Props } from './types';
            export const value = 1;
            """;

        List<RawReference> references = extractor.extract("src/index.ts", content);

        assertThat(references)
            .extracting(RawReference::text, RawReference::kind)
            .containsExactly(
                tuple("./all", ReferenceKind.EXPORT),
                tuple("./named", ReferenceKind.EXPORT),
                tuple("./types", ReferenceKind.EXPORT)
            );
    }

    @Test
    void extract_withDefaultAndNamespaceImports_extractsSpecifiers() {
        String content = """
            import React from 'react';
            import * as path from "path";
            import type { User } from '../models/user';
            """;

        List<RawReference> references = extractor.extract("src/App.tsx", content);

        assertThat(references)
            .extracting(RawReference::text)
            .containsExactly("react", "path", "../models/user");
    }

    @Test
    void extract_withCommentedImport_stillExtractsReference() {
        // Given: no comment stripping is performed
        String content = "// import old from './legacy'";

        List<RawReference> references = extractor.extract("src/a.js", content);

        assertThat(references).extracting(RawReference::text).containsExactly("./legacy");
    }

    @Test
    void extract_withWindowsLineEndings_reportsCorrectLines() {
        String content = "const a = 1;\r\nimport b from './b';\r\n";

        List<RawReference> references = extractor.extract("src/a.js", content);

        assertThat(references).hasSize(1);
        assertThat(references.get(0).lineNumber()).isEqualTo(2);
        assertThat(references.get(0).text()).isEqualTo("./b");
    }

    @Test
    void extract_withNullOrBlankContent_returnsEmptyList() {
        assertThat(extractor.extract("src/a.js", null)).isEmpty();
        assertThat(extractor.extract("src/a.js", "")).isEmpty();
        assertThat(extractor.extract("src/a.js", "   \n\n")).isEmpty();
    }

    @Test
    void extract_withMalformedContent_doesNotThrow() {
        String content = "import from from '' ''' ((( require( import(\"\n export { from \"";

        assertThatCode(() -> extractor.extract("src/bad.js", content)).doesNotThrowAnyException();
    }
}
