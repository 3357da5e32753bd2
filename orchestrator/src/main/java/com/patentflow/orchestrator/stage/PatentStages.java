package com.patentflow.orchestrator.stage;

import com.patentflow.orchestrator.codec.PayloadCodec;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The patent-drafting pipeline:
 *
 *   title2scene → scene2tech → tech2application → align2tex2docx
 *   info2tech   ↗                                 review2revise, md2docx (standalone)
 *
 * Timeout, heartbeat interval and endpoint name of each stage can be overridden with
 *   patentflow.stages.&lt;key&gt;.timeout / .heartbeat-interval / .endpoint
 */
@Configuration
public class PatentStages {

    private static final Duration DEFAULT_HEARTBEAT = Duration.ofSeconds(100);

    // Intermediate outputs of scene2tech, re-sent on every run so the remote side can resume.
    static final Map<String, String> SCENE2TECH_FILES = orderedPairs(
            "core_problem_analysis",        "1_core_problem_analysis.txt",
            "search_keywords_scene",        "2.1_search_keywords.txt",
            "prior_art_scene",              "2.2_prior_art.txt",
            "prior_solution_digest",        "2.3_prior_solution_digest.txt",
            "patent_gap_analysis",          "3_patent_gap_analysis.txt",
            "innovation_direction_0",       "4_1.1_innovation_direction.txt",
            "design_00",                    "4_1.2_design_0.txt",
            "design_01",                    "4_1.2_design_1.txt",
            "innovation_direction_1",       "4_2.1_innovation_direction.txt",
            "design_10",                    "4_2.2_design_0.txt",
            "design_11",                    "4_2.2_design_1.txt",
            "innovation_evaluation",        "5_innovation_evaluation.txt",
            "patent_tech",                  "6_patent_tech.txt",
            "validation_report",            "7_validation_report.txt",
            "final_tech",                   "tech.txt",
            "patentability_analysis_scene", "patentability.txt");

    static final Map<String, String> TECH2APPLICATION_FILES = orderedPairs(
            "tech_disclosure",                  "1_disclosure.txt",
            "search_keywords_tech",             "2.1_search_keywords.txt",
            "prior_art_tech",                   "2.2_prior_art.txt",
            "prior_art_analysis",               "2.3_prior_art_analysis.txt",
            "patentability_analysis_tech",      "patentability.txt",
            "diff_analysis",                    "3_diff_analysis.txt",
            "claims_plan",                      "4.0_claims_plan.txt",
            "claims_science_optimized",         "4.4_claims_science_optimized.txt",
            "claims_insufficiency_analysis",    "4.5_claims_insufficiency_analysis.txt",
            "claims_insufficiency_optimized",   "4.6_claims_insufficiency_optimized.txt",
            "claims_format_corrected",          "4.7_claims_format_corrected.txt",
            "description_initial",              "5.1_description_initial.txt",
            "description_innovation_analysis",  "5.2_description_innovation_analysis.txt",
            "description_innovation_optimized", "5.3_description_innovation_optimized.txt",
            "description_science_analysis",     "5.4_description_science_analysis.txt",
            "description_science_optimized",    "5.5_description_science_optimized.txt",
            "description_abstract",             "5.6_description_abstract.txt",
            "merged_application",               "6_merged_application.txt",
            "refined_technical_solution",       "7_refined_technical_solution.txt",
            "final_application",                "application.txt");

    private final Binder binder;

    public PatentStages(Environment environment) {
        this.binder = Binder.get(environment);
    }

    // ------------------------------------------------------------------
    // Drafting chain
    // ------------------------------------------------------------------

    @Bean
    public StageDefinition title2scene() {
        return stage("title2scene", "T2S", Duration.ofMinutes(60))
                .label("Title to scene")
                .requires("patent_title")
                .payload((in, codec) -> Map.of("patent_title", in.text("patent_title")))
                .maps("scene")
                .build();
    }

    @Bean
    public StageDefinition info2tech() {
        return stage("info2tech", "I2T", Duration.ofMinutes(60))
                .label("Disclosure files to technical solution")
                .requires("patent_title", "info_files")
                .payload((in, codec) -> Map.of(
                        "patent_title", in.text("patent_title"),
                        "info_files",   codec.compressJsonText(in.text("info_files"))))
                .maps("tech")
                .build();
    }

    @Bean
    public StageDefinition scene2tech() {
        return stage("scene2tech", "S2T", Duration.ofMinutes(60))
                .label("Scene to technical solution")
                .requires("patent_title", "scene")
                .payload((in, codec) -> Map.of(
                        "patent_title", in.text("patent_title"),
                        "base64file",   codec.compressText(in.text("scene")),
                        "mid_files",    codec.midFiles(in, SCENE2TECH_FILES)))
                .maps(SCENE2TECH_FILES.keySet().toArray(String[]::new))
                .mapsTo("final_tech", "tech")
                .build();
    }

    @Bean
    public StageDefinition tech2application() {
        return stage("tech2application", "T2A", Duration.ofMinutes(40))
                .label("Technical solution to application")
                .requires("patent_title", "tech")
                .payload((in, codec) -> Map.of(
                        "patent_title", in.text("patent_title"),
                        "base64file",   codec.compressText(in.text("tech")),
                        "mid_files",    codec.midFiles(in, TECH2APPLICATION_FILES)))
                .maps(TECH2APPLICATION_FILES.keySet().toArray(String[]::new))
                .mapsTo("final_application", "application")
                .build();
    }

    @Bean
    public StageDefinition align2tex2docx() {
        return stage("align2tex2docx", "A2D", Duration.ofMinutes(20))
                .label("Align, typeset and render the application")
                .requires("patent_title", "application")
                .payload((in, codec) -> Map.of(
                        "patent_title", in.text("patent_title"),
                        "base64file",   codec.compressText(in.text("application"))))
                .maps("application_align", "application_tex", "figure_codes")
                .mapsTo("application_align", "before_tex")
                .artifact("docx_bytes", ArtifactOutput.docx("docx"))
                .build();
    }

    // ------------------------------------------------------------------
    // Standalone stages
    // ------------------------------------------------------------------

    @Bean
    public StageDefinition md2docx() {
        return stage("md2docx", "M2D", Duration.ofMinutes(20))
                .label("Markdown to DOCX")
                .requires("md")
                .payload((in, codec) -> Map.of(
                        "md_base64", PayloadCodec.textToBase64(in.text("md")),
                        "is_patent", isTrue(in.text("is_patent")) ? 1 : 0))
                .artifact("docx_bytes", ArtifactOutput.docx("docx"))
                .build();
    }

    @Bean
    public StageDefinition review2revise() {
        return stage("review2revise", "R2R", Duration.ofMinutes(30))
                .label("Examiner review to reply and revision")
                .requires("review_pdf_base64", "current_application")
                .payload((in, codec) -> Map.of(
                        "review_base64", in.text("review_pdf_base64").strip(),
                        "claims_base64", PayloadCodec.textToBase64(in.text("current_application"))))
                .mapsTo("reply_review_txt", "reply_review")
                .mapsTo("revised_application_txt", "revised_application")
                .artifact("reply_review_docx_bytes", ArtifactOutput.docx("reply"))
                .artifact("revised_application_docx_bytes", ArtifactOutput.docx("revised"))
                .build();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StageDefinition.Builder stage(String key, String prefix, Duration defaultTimeout) {
        String base = "patentflow.stages." + key;
        return StageDefinition.builder(key)
                .stepIdPrefix(prefix)
                .timeout(binder.bind(base + ".timeout", Duration.class).orElse(defaultTimeout))
                .heartbeatInterval(binder.bind(base + ".heartbeat-interval", Duration.class).orElse(DEFAULT_HEARTBEAT))
                .endpoint(binder.bind(base + ".endpoint", String.class).orElse(key));
    }

    private static boolean isTrue(String flag) {
        String v = flag.strip();
        return v.equals("1") || v.equalsIgnoreCase("true") || v.equalsIgnoreCase("yes");
    }

    private static Map<String, String> orderedPairs(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
