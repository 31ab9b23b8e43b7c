package com.magicfolder.core.pipeline;

import com.magicfolder.core.escalation.BatchClassifier;
import com.magicfolder.core.escalation.EscalationBatcher;
import com.magicfolder.core.extract.ContentExtractor;
import com.magicfolder.core.extract.ExtractProperties;
import com.magicfolder.core.extract.OcrEngine;
import com.magicfolder.core.metrics.ClassifierMetrics;
import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.CategoryOverride;
import com.magicfolder.core.model.ClassificationRequest;
import com.magicfolder.core.model.ClassificationResponse;
import com.magicfolder.core.model.ClassificationResult;
import com.magicfolder.core.rules.HeuristicClassifier;
import com.magicfolder.core.rules.RuleSet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests for {@link ClassificationPipeline} with real rules and
 * extraction over temporary files. Only OCR and the batch classifier are mocked.
 */
class ClassificationPipelineTest {

    @TempDir
    Path tempDir;

    private OcrEngine ocrEngine;
    private BatchClassifier batchClassifier;
    private HeuristicClassifier classifier;
    private SimpleMeterRegistry registry;
    private ClassificationPipeline pipeline;

    @BeforeEach
    void setUp() {
        RuleSet rules = RuleSet.defaults();
        ocrEngine = mock(OcrEngine.class);
        batchClassifier = mock(BatchClassifier.class);
        classifier = spy(new HeuristicClassifier(rules));
        registry = new SimpleMeterRegistry();
        var metrics = new ClassifierMetrics(registry);

        pipeline = new ClassificationPipeline(
                new ContentExtractor(ocrEngine, rules, new ExtractProperties()),
                classifier,
                new EscalationBatcher(batchClassifier, metrics),
                new ResponseAssembler(),
                metrics);
    }

    private String write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file.toString();
    }

    private static Category categoryOf(ClassificationResponse response, String path) {
        return response.resultFor(path).map(ClassificationResult::category).orElseThrow();
    }

    @Test
    @DisplayName("hard rule and keyword rule resolve without escalation")
    void hardRuleAndKeyword() throws IOException {
        String audio = tempDir.resolve("a.mp3").toString();
        String invoice = write("b.txt", "TAX INVOICE\nGSTIN: 29ABCDE1234F1Z5\nTotal 1200");

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(audio, invoice));

        assertFalse(response.hasError());
        assertEquals(2, response.results().size());
        assertEquals(Category.AUDIO, categoryOf(response, audio));
        assertEquals(Category.INVOICES, categoryOf(response, invoice));
        verify(batchClassifier, never()).classify(anyList());
    }

    @Test
    @DisplayName("nonexistent file with unknown extension is Misc")
    void nonexistentFile() {
        ClassificationResponse response = pipeline.process(ClassificationRequest.of("/nonexistent.xyz"));

        assertEquals(1, response.results().size());
        assertEquals(Category.MISC, categoryOf(response, "/nonexistent.xyz"));
        assertNull(response.results().get(0).error());
    }

    @Test
    @DisplayName("results come back in request order with one entry per path")
    void oneResultPerPath() throws IOException {
        String notes = write("n.md", "Minutes of meeting\nAction items: ship it");
        String video = tempDir.resolve("clip.MKV").toString();
        String plain = write("plain.txt", "nothing to see here");
        when(batchClassifier.available()).thenReturn(false);

        ClassificationResponse response = pipeline.process(
                new ClassificationRequest(List.of(notes, video, plain, notes)));

        assertEquals(List.of(notes, video, plain),
                response.results().stream().map(ClassificationResult::path).toList());
        assertEquals(Category.NOTES, categoryOf(response, notes));
        assertEquals(Category.VIDEO, categoryOf(response, video));
        assertEquals(Category.MISC, categoryOf(response, plain));
    }

    @Test
    @DisplayName("a failure on one file leaves the rest of the batch intact")
    void perFileIsolation() throws IOException {
        String broken = write("broken.txt", "whatever");
        String ticket = write("ticket.txt", "IRCTC e-ticket PNR 4521236789");
        doThrow(new IllegalStateException("boom")).when(classifier).evaluate(eq(broken), anyString());

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(broken, ticket));

        ClassificationResult failed = response.resultFor(broken).orElseThrow();
        assertEquals(Category.MISC, failed.category());
        assertEquals("classification failed: boom", failed.error());
        assertEquals(Category.TRAIN_TICKETS, categoryOf(response, ticket));
        assertEquals(1.0, registry.find("magicfolder.file.errors")
                .tag("stage", "classification").counter().count());
    }

    @Test
    @DisplayName("uncertain files are escalated together in a single call")
    void singleEscalationCall() throws IOException {
        String cv = write("cv.txt", "Work experience: 5 years as backend engineer. Skills: Java");
        String essay = write("essay.md", "The history of the printing press");
        String song = tempDir.resolve("song.flac").toString();
        when(batchClassifier.available()).thenReturn(true);
        when(batchClassifier.classify(anyList())).thenReturn(List.of(
                new CategoryOverride(cv, Category.RESUME, 0.9, "work history and skills"),
                new CategoryOverride(essay, Category.DOCUMENTS, 0.6, "prose")));

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(cv, essay, song));

        verify(batchClassifier, times(1)).classify(argThat(items -> items.size() == 2));
        assertEquals(Category.RESUME, categoryOf(response, cv));
        assertEquals(Category.DOCUMENTS, categoryOf(response, essay));
        assertEquals(Category.AUDIO, categoryOf(response, song));
    }

    @Test
    @DisplayName("overrides never replace a hard rule or keyword verdict")
    void overridesOnlyApplyToMisc() throws IOException {
        String invoice = write("inv.txt", "Tax Invoice, amount due 400");
        String archive = tempDir.resolve("backup.zip").toString();
        String unknown = write("x.txt", "lorem ipsum");
        when(batchClassifier.available()).thenReturn(true);
        when(batchClassifier.classify(anyList())).thenReturn(List.of(
                new CategoryOverride(invoice, Category.NOTES, 0.9, "wrong"),
                new CategoryOverride(archive, Category.CODE, 0.9, "wrong"),
                new CategoryOverride(unknown, Category.DOCUMENTS, 0.5, "prose")));

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(invoice, archive, unknown));

        assertEquals(Category.INVOICES, categoryOf(response, invoice));
        assertEquals(Category.ARCHIVES, categoryOf(response, archive));
        assertEquals(Category.DOCUMENTS, categoryOf(response, unknown));
    }

    @Test
    @DisplayName("unavailable batch classifier keeps uncertain files as Misc")
    void unavailableClassifier() throws IOException {
        String unknown = write("x.txt", "lorem ipsum");
        when(batchClassifier.available()).thenReturn(false);

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(unknown));

        assertEquals(Category.MISC, categoryOf(response, unknown));
        verify(batchClassifier, never()).classify(anyList());
    }

    @Test
    @DisplayName("failing batch classifier keeps uncertain files as Misc")
    void failingClassifier() throws IOException {
        String unknown = write("x.txt", "lorem ipsum");
        when(batchClassifier.available()).thenReturn(true);
        when(batchClassifier.classify(anyList())).thenThrow(new RuntimeException("quota exceeded"));

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(unknown));

        assertEquals(Category.MISC, categoryOf(response, unknown));
    }

    @Test
    @DisplayName("request metrics are recorded and MDC is cleared afterwards")
    void metricsAndMdc() throws IOException {
        String invoice = write("inv.txt", "GSTIN 29ABCDE");

        pipeline.process(ClassificationRequest.of(invoice, "/tmp/a.mp3"));

        assertEquals(1.0, registry.find("magicfolder.requests.total").counter().count());
        assertEquals(2.0, registry.find("magicfolder.files.total").counter().count());
        assertEquals(1.0, registry.find("magicfolder.files.classified")
                .tag("category", "Audio").tag("source", "hard_rule").counter().count());
        assertNull(MDC.get("requestId"));
    }

    @Test
    @DisplayName("a native OCR crash on one file leaves its neighbours classified")
    void nativeOcrErrorIsIsolated() throws IOException {
        String scan = write("scan.png", "not really a png");
        String ticket = write("t.txt", "IRCTC Electronic Reservation Slip, PNR 8412345678");
        when(ocrEngine.available()).thenReturn(true);
        when(ocrEngine.extract(Path.of(scan))).thenThrow(new Error("Invalid memory access"));

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(scan, ticket));

        assertEquals(2, response.results().size());
        ClassificationResult failed = response.resultFor(scan).orElseThrow();
        assertEquals(Category.MISC, failed.category());
        assertEquals("extraction failed: Invalid memory access", failed.error());
        assertEquals(Category.TRAIN_TICKETS, categoryOf(response, ticket));
        assertEquals(1.0, registry.find("magicfolder.file.errors")
                .tag("stage", "extraction").counter().count());
    }

    @Test
    @DisplayName("a linkage error while classifying one file degrades only that file")
    void linkageErrorIsIsolated() throws IOException {
        String broken = write("broken.txt", "whatever");
        String invoice = write("inv.txt", "Tax Invoice, amount due 400");
        doThrow(new NoClassDefFoundError("com/sun/jna/Native"))
                .when(classifier).evaluate(eq(broken), anyString());

        ClassificationResponse response = pipeline.process(ClassificationRequest.of(broken, invoice));

        ClassificationResult failed = response.resultFor(broken).orElseThrow();
        assertEquals(Category.MISC, failed.category());
        assertEquals("classification failed: com/sun/jna/Native", failed.error());
        assertEquals(Category.INVOICES, categoryOf(response, invoice));
    }

    @Test
    @DisplayName("virtual machine errors are not swallowed")
    void virtualMachineErrorPropagates() throws IOException {
        String file = write("big.txt", "whatever");
        doThrow(new OutOfMemoryError("Java heap space")).when(classifier).evaluate(eq(file), anyString());

        assertThrows(OutOfMemoryError.class, () -> pipeline.process(ClassificationRequest.of(file)));
        assertNull(MDC.get("requestId"));
    }
}
