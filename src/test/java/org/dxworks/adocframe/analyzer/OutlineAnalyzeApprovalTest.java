package org.dxworks.adocframe.analyzer;

import org.approvaltests.Approvals;
import org.dxworks.adocframe.AdocframeConfig;
import org.dxworks.adocframe.App;
import org.dxworks.adocframe.TestUtils;
import org.dxworks.adocframe.model.outline.DocumentOutline;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class OutlineAnalyzeApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/asciidoc/";

    @Test
    void analyze_Basic() throws IOException {
        verify("Basic.adoc");
    }

    @Test
    void analyze_Book_with_includes() throws IOException {
        verify("Book.adoc");
    }

    private static void verify(String fileName) throws IOException {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + fileName);
        DocumentOutline outline = App.analyzeFile(filePath, AdocframeConfig.with(20000, 64, true));
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(outline));
    }
}
