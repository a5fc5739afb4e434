package com.nosota.lingodesk.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentClassifierTest {

    private final ContentClassifier classifier = new ContentClassifier();

    @Test
    void shortSamplesAreUnknown() {
        assertThat(classifier.detectLanguage("Too short to tell")).isEqualTo(ContentClassifier.UNKNOWN_LANGUAGE);
        assertThat(classifier.detectLanguage(null)).isEqualTo(ContentClassifier.UNKNOWN_LANGUAGE);
    }

    @Test
    void detectsLanguagesByStopWords() {
        assertThat(classifier.detectLanguage(
                "The contract is signed by the parties and the court is in charge of the dispute for the plaintiff."))
                .isEqualTo("English");
        assertThat(classifier.detectLanguage(
                "El contrato de la empresa es muy importante para los clientes y las personas que trabajan con nosotros"))
                .isEqualTo("Spanish");
        assertThat(classifier.detectLanguage(
                "Le chat est dans le jardin avec les enfants et le chien pour toujours sur le tapis rouge du salon"))
                .isEqualTo("French");
        assertThat(classifier.detectLanguage(
                "Der Hund und die Katze sind auf dem Tisch mit der Familie durch das Fenster"))
                .isEqualTo("German");
    }

    @Test
    void fallsBackToDefaultLanguage() {
        assertThat(classifier.detectLanguage(
                "Lorem ipsum dolor sit amet consectetur adipiscing elit sed do eiusmod tempor incididunt"))
                .isEqualTo(ContentClassifier.DEFAULT_LANGUAGE);
    }

    @Test
    void ignoresNonAsciiCharacters() {
        String padded = "éèê".repeat(40) + " the";
        assertThat(classifier.detectLanguage(padded)).isEqualTo(ContentClassifier.UNKNOWN_LANGUAGE);
    }

    @Test
    void detectsSubjectMatter() {
        assertThat(classifier.detectSubjectMatter("The software runs on a server and talks to the database through an API"))
                .isEqualTo("Technical/IT");
        assertThat(classifier.detectSubjectMatter("The patient saw a doctor at the hospital for treatment"))
                .isEqualTo("Medical/Healthcare");
    }

    @Test
    void lowScoresAreGeneralContent() {
        assertThat(classifier.detectSubjectMatter("The contract went to court")).isEqualTo(ContentClassifier.GENERAL_CONTENT);
        assertThat(classifier.detectSubjectMatter("")).isEqualTo(ContentClassifier.GENERAL_CONTENT);
    }
}
