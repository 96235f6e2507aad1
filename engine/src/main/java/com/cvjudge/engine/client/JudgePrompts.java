package com.cvjudge.engine.client;

/**
 * Prompt text shared by every provider adapter.
 *
 * All judges receive the same instruction so their answers are comparable;
 * only the transport differs between providers. The JSON schema described
 * here is the one {@code JudgePayloadParser} validates against.
 */
public final class JudgePrompts {

    private JudgePrompts() {}

    /**
     * Build the single user message sent to a judge.
     *
     * @param guidance optional, appended as a "Special Guidance" section
     */
    public static String evaluationPrompt(String cvText, String jdText, String guidance) {
        String guidanceSection = (guidance == null || guidance.isBlank())
                ? ""
                : "\n\n**Special Guidance:** " + guidance;

        return EVALUATION_PROMPT
                .replace("{{GUIDANCE}}", guidanceSection)
                .replace("{{JD}}", jdText)
                .replace("{{CV}}", cvText);
    }

    /**
     * Guidance for a repair call: the original guidance plus a corrective
     * instruction naming what was wrong with the previous answer.
     */
    public static String repairGuidance(String guidance, String problem) {
        String correction = REPAIR_INSTRUCTION.replace("{{PROBLEM}}", problem);
        return (guidance == null || guidance.isBlank())
                ? correction
                : guidance + "\n\n" + correction;
    }

    private static final String EVALUATION_PROMPT = """
            You are an expert technical recruiter evaluating a candidate's CV against a job description.

            Provide a structured, evidence-based evaluation:

            1. Extract 3-5 key requirements from the job description
            2. For each requirement, search for verbatim evidence in the CV
            3. Identify matching skills and missing requirements
            4. Note any red flags or concerns
            5. Highlight the candidate's key strengths
            6. Provide an overall match score (0-100) with detailed rationale

            Be specific and cite evidence directly from the documents. Do not hallucinate qualifications.{{GUIDANCE}}

            **Job Description:**
            {{JD}}

            **Candidate CV:**
            {{CV}}

            Respond with a single valid JSON object matching this schema and nothing else:
            {
                "score": <integer 0-100>,
                "matching_skills": [<skills and requirements the CV satisfies>],
                "missing_requirements": [<JD requirements not evidenced in the CV>],
                "red_flags": [<concerns>],
                "strengths": [<key strengths>],
                "rationale": "<detailed reasoning for the score>"
            }
            """;

    private static final String REPAIR_INSTRUCTION = """
            IMPORTANT: your previous answer could not be used ({{PROBLEM}}).
            Answer again with ONLY the JSON object described above: "score" must be an
            integer between 0 and 100, and every list field must be an array of strings.""";
}
