package com.jobtailor.ai.prompt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptTemplatesTest {

    private PromptTemplates templates;

    @BeforeEach
    void setUp() {
        templates = new PromptTemplates();
        templates.loadPrompts();
    }

    @Test
    void cvPromptContainsJobDetailsAndTemplate() {
        String prompt = templates.getCvTailoring("MY CV", "Backend Engineer", "Acme", "Build APIs");

        assertTrue(prompt.contains("Original CV:\nMY CV"));
        assertTrue(prompt.contains("Job Title: Backend Engineer"));
        assertTrue(prompt.contains("Company: Acme"));
        assertTrue(prompt.contains("Job Description:\nBuild APIs"));
        assertFalse(prompt.contains("{jobTitle}"));
    }

    @Test
    void missingDescriptionIsSpelledOut() {
        String prompt = templates.getCoverLetter("MY CV", "Backend Engineer", "Acme", " ");

        assertTrue(prompt.contains("No description provided"));
        assertTrue(prompt.startsWith("Write a professional cover letter"));
    }

    @Test
    void placeholdersInsideUserContentAreLeftAlone() {
        String prompt = templates.getCvTailoring("Uses {company} literally", "{description}", "Acme", "desc");

        assertTrue(prompt.contains("Uses {company} literally"));
        assertTrue(prompt.contains("Job Title: {description}"));
    }

    @Test
    void defaultCvHasStandardSections() {
        String cv = templates.getDefaultCv();

        assertTrue(cv.contains("SUMMARY"));
        assertTrue(cv.contains("EXPERIENCE"));
        assertTrue(cv.contains("EDUCATION"));
    }
}
