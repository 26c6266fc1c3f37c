package com.repograph.core.graph;

import com.repograph.core.index.FileIndex;
import com.repograph.core.model.FileNode;
import com.repograph.core.model.FileRecord;
import com.repograph.core.model.LanguageFamily;
import com.repograph.core.model.Relationship;
import com.repograph.core.model.RelationshipGraph;
import com.repograph.core.model.RelationshipKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link RelationshipGraphBuilder}.
 */
class RelationshipGraphBuilderTest {

    private RelationshipGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new RelationshipGraphBuilder();
    }

    @Test
    void analyze_typeScriptImport_producesSingleImport() {
        // Given
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("src/index.ts", "import { helper } from './utils';\nhelper();\n"),
            FileNode.of("src/utils.ts", "export const helper = () => 1;\n")));

        // When
        RelationshipGraph graph = builder.analyze(index);

        // Then
        assertThat(graph.relationships()).containsExactly(
            new Relationship("src/index.ts", "src/utils.ts", RelationshipKind.IMPORT, 1, "./utils"));
        assertThat(graph.statistics().filesIndexed()).isEqualTo(2);
        assertThat(graph.statistics().filesAnalyzed()).isEqualTo(2);
        assertThat(graph.statistics().referencesExtracted()).isEqualTo(1);
        assertThat(graph.statistics().referencesResolved()).isEqualTo(1);
        assertThat(graph.statistics().cancelled()).isFalse();
    }

    @Test
    void analyze_externalPackages_produceNoRelationships() {
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("src/app.ts", "import React from 'react';\nimport { join } from 'node:path';\n"),
            FileNode.of("main.py", "import requests\n")));

        RelationshipGraph graph = builder.analyze(index);

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.statistics().unresolvedReferences()).isEqualTo(3);
    }

    @Test
    void analyze_relationshipsOnlyConnectIndexedFiles() {
        // Given
        FileIndex index = mixedRepository();

        // When
        RelationshipGraph graph = builder.analyze(index);

        // Then
        assertThat(graph.relationships()).isNotEmpty();
        assertThat(graph.relationships()).allSatisfy(rel -> {
            assertThat(index.containsPath(rel.fromFile())).isTrue();
            assertThat(index.containsPath(rel.toFile())).isTrue();
        });
    }

    @Test
    void analyze_mixedRepository_resolvesEveryLanguage() {
        RelationshipGraph graph = builder.analyze(mixedRepository());

        assertThat(graph.relationships())
            .extracting(Relationship::fromFile, Relationship::toFile)
            .contains(
                tuple("app/main.py", "app/config.py"),
                tuple("cmd/server/main.go", "internal/handlers/users.go"),
                tuple("native/main.c", "native/util.h"),
                tuple("src/App.swift", "src/Models.swift"),
                tuple("src/index.ts", "src/utils.ts"),
                tuple("src/lib.rs", "src/parser.rs"),
                tuple("src/main/java/com/example/App.java", "src/main/java/com/example/model/User.java"));
    }

    @Test
    void analyze_outputIsOrderedBySourcePath() {
        // Given
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("z.ts", "import './a';"),
            FileNode.of("a.ts", "import './z';")));

        // When
        RelationshipGraph graph = builder.analyze(index);

        // Then
        assertThat(graph.relationships())
            .extracting(Relationship::fromFile)
            .containsExactly("a.ts", "z.ts");
    }

    @Test
    void analyze_cyclicImports_keepsBothDirections() {
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("a.ts", "import { b } from './b';"),
            FileNode.of("b.ts", "import { a } from './a';")));

        RelationshipGraph graph = builder.analyze(index);

        assertThat(graph.between("a.ts", "b.ts")).hasSize(1);
        assertThat(graph.between("b.ts", "a.ts")).hasSize(1);
    }

    @Test
    void analyze_repeatedImports_areNotDeduplicated() {
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("a.ts", "import { x } from './b';\nimport { y } from './b';\n"),
            FileNode.of("b.ts", "")));

        RelationshipGraph graph = builder.analyze(index);

        assertThat(graph.between("a.ts", "b.ts"))
            .extracting(Relationship::lineNumber)
            .containsExactly(1, 2);
    }

    @Test
    void analyze_pythonImportList_resolvesEachModule() {
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("main.py", "import os, sys as s, json\n"),
            FileNode.of("os.py", "x = 1\n"),
            FileNode.of("json.py", "y = 2\n")));

        RelationshipGraph graph = builder.analyze(index);

        assertThat(graph.outgoing("main.py"))
            .extracting(Relationship::toFile, Relationship::lineNumber, Relationship::identifier)
            .containsExactly(tuple("os.py", 1, "os"), tuple("json.py", 1, "json"));
        assertThat(graph.statistics().unresolvedReferences()).isEqualTo(1);
    }

    @Test
    void analyze_reExport_producesExportRelationship() {
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("src/index.ts", "export { helper } from './utils';\n"),
            FileNode.of("src/utils.ts", "export const helper = 1;\n")));

        RelationshipGraph graph = builder.analyze(index);

        assertThat(graph.relationships()).singleElement()
            .extracting(Relationship::kind)
            .isEqualTo(RelationshipKind.EXPORT);
    }

    @Test
    void analyze_swiftTypeUsage_pointsFromUserToDeclaration() {
        // Given
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("Sources/Models.swift", "import Foundation\n\nstruct User {\n    let name: String\n}\n"),
            FileNode.of("Sources/ProfileView.swift", "struct ProfileView {\n    let user: User\n}\n")));

        // When
        RelationshipGraph graph = builder.analyze(index);

        // Then
        assertThat(graph.relationships()).containsExactly(
            new Relationship("Sources/ProfileView.swift", "Sources/Models.swift", RelationshipKind.IMPORT, 3, "User"));
        assertThat(graph.between("Sources/Models.swift", "Sources/ProfileView.swift")).isEmpty();
    }

    @Test
    void analyze_filesWithoutContent_areSkipped() {
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("src/a.ts", null),
            FileNode.of("src/b.ts", ""),
            FileNode.of("README.md", "# readme")));

        RelationshipGraph graph = builder.analyze(index);

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.statistics().filesSkipped()).isEqualTo(3);
        assertThat(graph.statistics().filesAnalyzed()).isZero();
    }

    @Test
    void analyze_emptyIndex_returnsEmptyGraph() {
        assertThat(builder.analyze(FileIndex.empty())).isEqualTo(RelationshipGraph.empty());
        assertThat(builder.analyze((FileIndex) null)).isEqualTo(RelationshipGraph.empty());
    }

    @Test
    void analyze_sameIndexTwice_returnsEqualGraphs() {
        FileIndex index = mixedRepository();

        RelationshipGraph first = builder.analyze(index);
        RelationshipGraph second = builder.analyze(index);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void analyze_inParallel_matchesSequentialRun() {
        // Given
        List<FileNode> files = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            files.add(FileNode.of("src/module" + i + ".ts",
                "import { value } from './module" + ((i + 1) % 40) + "';\nimport React from 'react';\n"));
        }
        files.addAll(mixedFiles());
        FileIndex index = FileIndex.of(files);

        // When
        RelationshipGraph sequential = new RelationshipGraphBuilder().analyze(index, AnalysisOptions.defaults());
        RelationshipGraph parallel = new RelationshipGraphBuilder()
            .analyze(index, AnalysisOptions.defaults().withParallelism(4));

        // Then
        assertThat(parallel.relationships()).isEqualTo(sequential.relationships());
        assertThat(parallel.statistics()).isEqualTo(sequential.statistics());
    }

    @Test
    void analyze_withLanguageFilter_onlyAnalyzesSelectedFamilies() {
        AnalysisOptions options = AnalysisOptions.defaults().withFamilies(Set.of(LanguageFamily.PYTHON));

        RelationshipGraph graph = builder.analyze(mixedRepository(), options);

        assertThat(graph.relationships())
            .isNotEmpty()
            .allSatisfy(rel -> assertThat(rel.fromFile()).endsWith(".py"));
        assertThat(graph.statistics().filesSkipped()).isPositive();
    }

    @Test
    void analyze_failingAnalyzer_countsFailureAndContinues() {
        // Given
        LanguageAnalyzer failing = new LanguageAnalyzer() {
            @Override
            public LanguageFamily getFamily() {
                return LanguageFamily.PYTHON;
            }

            @Override
            public FileAnalysis analyze(FileRecord file, AnalysisContext context) {
                throw new IllegalStateException("boom");
            }
        };
        RelationshipGraphBuilder failingBuilder =
            new RelationshipGraphBuilder(LanguageStrategies.standard().with(LanguageFamily.PYTHON, failing));
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("a.ts", "import './b';"),
            FileNode.of("b.ts", ""),
            FileNode.of("main.py", "import os\n")));

        // When
        RelationshipGraph graph = failingBuilder.analyze(index);

        // Then
        assertThat(graph.relationships()).extracting(Relationship::fromFile).containsExactly("a.ts");
        assertThat(graph.statistics().filesFailed()).isEqualTo(1);
        assertThat(graph.statistics().topErrors()).containsExactly("main.py: boom");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4})
    void analyze_malformedContentInEveryLanguage_neverFails(int parallelism) {
        // Given: the same broken text in one file of every language family
        String junk = "import (\n\"\n from . import\nuse ::\n#include <\nimport static ;\nclass \u0000 {\n"
            + "import x from '".repeat(2000) + "\n";
        List<String> paths = List.of(
            "src/a.ts", "src/b.jsx", "app/c.py", "src/D.java", "cmd/e.go",
            "native/f.c", "native/g.hpp", "src/h.rs", "Sources/I.swift");
        FileIndex index = FileIndex.of(paths.stream().map(path -> FileNode.of(path, junk)).toList());
        AnalysisOptions options = AnalysisOptions.defaults().withParallelism(parallelism);

        // When
        AtomicReference<RelationshipGraph> result = new AtomicReference<>();
        assertThatCode(() -> result.set(builder.analyze(index, options))).doesNotThrowAnyException();

        // Then
        RelationshipGraph graph = result.get();
        assertThat(graph.statistics().filesFailed()).isZero();
        assertThat(graph.statistics().filesAnalyzed()).isEqualTo(paths.size());
        assertThat(graph.relationships()).allSatisfy(rel -> {
            assertThat(index.containsPath(rel.fromFile())).isTrue();
            assertThat(index.containsPath(rel.toFile())).isTrue();
        });
    }

    @Test
    void cancel_beforeRun_returnsEmptyCancelledGraph() {
        builder.cancel();

        RelationshipGraph graph = builder.analyze(mixedRepository());

        assertThat(builder.isCancelled()).isTrue();
        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.statistics().cancelled()).isTrue();
        assertThat(graph.statistics().filesAnalyzed()).isZero();
    }

    @Test
    void cancel_duringRun_keepsRelationshipsFoundSoFar() {
        // Given
        AtomicReference<RelationshipGraphBuilder> holder = new AtomicReference<>();
        LanguageAnalyzer standard = LanguageStrategies.standard().forFamily(LanguageFamily.JAVASCRIPT);
        LanguageAnalyzer cancelling = new LanguageAnalyzer() {
            @Override
            public LanguageFamily getFamily() {
                return LanguageFamily.JAVASCRIPT;
            }

            @Override
            public FileAnalysis analyze(FileRecord file, AnalysisContext context) {
                holder.get().cancel();
                return standard.analyze(file, context);
            }
        };
        RelationshipGraphBuilder cancellingBuilder =
            new RelationshipGraphBuilder(LanguageStrategies.standard().with(LanguageFamily.JAVASCRIPT, cancelling));
        holder.set(cancellingBuilder);
        FileIndex index = FileIndex.of(List.of(
            FileNode.of("a.ts", "import './b';"),
            FileNode.of("b.ts", "import './c';"),
            FileNode.of("c.ts", "import './a';")));

        // When
        RelationshipGraph graph = cancellingBuilder.analyze(index);

        // Then
        assertThat(graph.relationships())
            .extracting(Relationship::fromFile, Relationship::toFile)
            .containsExactly(tuple("a.ts", "b.ts"));
        assertThat(graph.statistics().cancelled()).isTrue();
        assertThat(graph.statistics().filesAnalyzed()).isEqualTo(1);
    }

    private static FileIndex mixedRepository() {
        return FileIndex.of(mixedFiles());
    }

    private static List<FileNode> mixedFiles() {
        return List.of(
            FileNode.of("app/main.py", "from app.config import settings\nimport numpy\n"),
            FileNode.of("app/config.py", "settings = {}\n"),
            FileNode.of("cmd/server/main.go", "package main\n\nimport (\n\t\"fmt\"\n\t\"example.com/svc/internal/handlers\"\n)\n"),
            FileNode.of("internal/handlers/users.go", "package handlers\n"),
            FileNode.of("native/main.c", "#include \"util.h\"\n#include <stdio.h>\n"),
            FileNode.of("native/util.h", "int util(void);\n"),
            FileNode.of("src/App.swift", "let current = Account()\n"),
            FileNode.of("src/Models.swift", "final class Account {\n}\n"),
            FileNode.of("src/index.ts", "import { helper } from './utils';\n"),
            FileNode.of("src/utils.ts", "export const helper = 1;\n"),
            FileNode.of("src/lib.rs", "mod parser;\nuse std::fmt;\n"),
            FileNode.of("src/parser.rs", "pub fn parse() {}\n"),
            FileNode.of("src/main/java/com/example/App.java",
                "package com.example;\n\nimport com.example.model.User;\nimport java.util.List;\n"),
            FileNode.of("src/main/java/com/example/model/User.java", "package com.example.model;\n"));
    }
}
