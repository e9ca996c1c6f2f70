package com.certextract.infrastructure.ai;

import org.springframework.stereotype.Component;

/**
 * Prompts shared by every model backend. All of them ask for one JSON object in the
 * canonical certificate shape so a single mapper can normalize the answers.
 */
@Component
public class ExtractionPromptBuilder {

    static final int MAX_TEXT_CHARS = 50_000;

    private static final String SYSTEM_PROMPT = """
            You extract structured data from UK property compliance certificates
            (gas safety, EICR, EPC, fire risk assessment, asbestos, legionella, lifts and similar).
            Answer with a single JSON object and nothing else. Use null for anything not stated
            in the document; never guess.

            {
              "certificateType": "GAS | EICR | EPC | FRA | PAT | LEGIONELLA | ASBESTOS | LIFT | EMLT | FIRE_ALARM | SMOKE_CO | FIRE_DOOR | OIL | LPG | SOLID | ASHP | GSHP | UNKNOWN",
              "certificateNumber": string,
              "propertyAddress": string,
              "uprn": string,
              "inspectionDate": "YYYY-MM-DD",
              "expiryDate": "YYYY-MM-DD",
              "nextInspectionDate": "YYYY-MM-DD",
              "outcome": "PASS | FAIL | SATISFACTORY | UNSATISFACTORY | N/A",
              "engineerName": string,
              "engineerRegistration": string,
              "contractorName": string,
              "contractorRegistration": string,
              "appliances": [{"location", "type", "make", "model", "serialNumber", "outcome", "defects": [string]}],
              "defects": [{"code", "description", "location", "priority": "IMMEDIATE | URGENT | ADVISORY | ROUTINE"}],
              "additionalFields": {"name": "value"}
            }
            """;

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String textUserMessage(String documentText, String expectedType) {
        String text = documentText.length() > MAX_TEXT_CHARS
                ? documentText.substring(0, MAX_TEXT_CHARS)
                : documentText;
        return typeHint(expectedType) + "Document text:\n\n" + text;
    }

    public String visionInstruction(String expectedType) {
        return typeHint(expectedType) + "Extract the certificate data from the attached page image(s).";
    }

    private static String typeHint(String expectedType) {
        if (expectedType == null) return "";
        return "The document is expected to be a " + expectedType + " certificate.\n";
    }
}
