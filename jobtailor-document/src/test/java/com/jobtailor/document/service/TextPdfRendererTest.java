package com.jobtailor.document.service;

import com.jobtailor.document.config.DocumentProperties;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextPdfRendererTest {

    private final TextPdfRenderer renderer = new TextPdfRenderer(new DocumentProperties());

    @Test
    void rendersCvTextWithTitleMetadata() throws IOException {
        String cv = "Jane Roe\nBackend Engineer\n\nSUMMARY\nFive years building Java services.\n\n"
                + "Skills:\n- Java, Spring Boot, PostgreSQL\n";

        byte[] pdf = renderer.render(cv, "CV_Backend Engineer");

        try (PDDocument document = Loader.loadPDF(pdf)) {
            assertEquals(1, document.getNumberOfPages());
            assertEquals("CV_Backend Engineer", document.getDocumentInformation().getTitle());
            String text = new PDFTextStripper().getText(document);
            assertTrue(text.contains("SUMMARY"));
            assertTrue(text.contains("Five years building Java services."));
            assertTrue(text.contains("- Java, Spring Boot, PostgreSQL"));
        }
    }

    @Test
    void longTextFlowsOntoAdditionalPages() throws IOException {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            text.append("Line ").append(i).append(" of a rather long cover letter paragraph.\n");
        }

        try (PDDocument document = Loader.loadPDF(renderer.render(text.toString(), "long"))) {
            assertTrue(document.getNumberOfPages() > 1);
            String extracted = new PDFTextStripper().getText(document);
            assertTrue(extracted.contains("Line 199 of a rather long cover letter paragraph."));
        }
    }

    @Test
    void wideParagraphsAreWrappedInsteadOfClipped() throws IOException {
        String sentence = "Designed and operated distributed job ingestion pipelines across several regions ";
        String paragraph = sentence.repeat(6).trim();

        try (PDDocument document = Loader.loadPDF(renderer.render(paragraph, "wrap"))) {
            String extracted = new PDFTextStripper().getText(document);
            assertTrue(extracted.strip().split("\\R").length > 1);
            assertTrue(extracted.contains("regions"));
        }
    }

    @Test
    void unsupportedCharactersAreReplaced() throws IOException {
        byte[] pdf = renderer.render("Name: 张三 🚀\tReady", "unicode");

        try (PDDocument document = Loader.loadPDF(pdf)) {
            String extracted = new PDFTextStripper().getText(document);
            assertTrue(extracted.contains("Name: ??"));
            assertTrue(extracted.contains("Ready"));
            assertFalse(extracted.contains("张"));
        }
    }

    @Test
    void emptyTextStillProducesOnePage() throws IOException {
        try (PDDocument document = Loader.loadPDF(renderer.render(null, "empty"))) {
            assertEquals(1, document.getNumberOfPages());
        }
    }

    @Test
    void headingDetectionFollowsCaseAndLength() {
        assertTrue(renderer.isHeading("EXPERIENCE"));
        assertTrue(renderer.isHeading("SKILLS & TOOLS"));
        assertFalse(renderer.isHeading("Experience"));
        assertFalse(renderer.isHeading("2020 - 2024"));
        assertFalse(renderer.isHeading("A VERY LONG LINE THAT IS WRITTEN ENTIRELY IN CAPITALS"));
        assertTrue(renderer.isSubheading("Job Description:"));
        assertFalse(renderer.isSubheading("Responsibilities include the following"));
    }
}
