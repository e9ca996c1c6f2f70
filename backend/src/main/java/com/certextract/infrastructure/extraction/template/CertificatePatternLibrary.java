package com.certextract.infrastructure.extraction.template;

import com.certextract.domain.extraction.model.CustomPatternConfig;
import com.certextract.domain.extraction.model.DefectPriority;
import com.certextract.domain.extraction.model.DefectRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Built-in regex templates per certificate type, merged with operator-supplied custom patterns.
 * Every pattern's first capture group is the field value.
 */
@Slf4j
@Component
public class CertificatePatternLibrary {

    /**
     * Patterns for one field, tried in order until one matches.
     */
    public record FieldPattern(String field, List<Pattern> patterns, UnaryOperator<String> transform, boolean required) {

        public String extract(String text) {
            for (Pattern pattern : patterns) {
                Matcher m = pattern.matcher(text);
                if (m.find() && m.groupCount() >= 1 && m.group(1) != null) {
                    String value = m.group(1).trim();
                    if (value.isEmpty()) continue;
                    String transformed = transform == null ? value : transform.apply(value);
                    return transformed == null || transformed.isBlank() ? null : transformed;
                }
            }
            return null;
        }
    }

    private record DefectCode(String code, DefectPriority priority, List<Pattern> patterns) {}

    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final UnaryOperator<String> DATE = CertificateDates::normalize;
    private static final UnaryOperator<String> UPPER = v -> v.toUpperCase(Locale.ROOT).replaceAll("\\s+", "_");
    private static final UnaryOperator<String> GAS_OUTCOME = v -> {
        String upper = v.toUpperCase(Locale.ROOT);
        if (upper.contains("UNSATISFACTORY") || upper.contains("FAIL")) return "FAIL";
        if (upper.contains("SATISFACTORY") || upper.contains("PASS")) return "PASS";
        return null;
    };
    private static final UnaryOperator<String> EICR_OUTCOME = v ->
            v.toUpperCase(Locale.ROOT).contains("UNSATISFACTORY") ? "UNSATISFACTORY" : "SATISFACTORY";

    private static final Map<String, List<FieldPattern>> BUILT_IN = Map.of(
            "GAS", List.of(
                    field("certificateNumber", true, null,
                            "certificate\\s*(?:number|no|ref)\\.?[:\\s]*([A-Z0-9][A-Z0-9\\-/]*)",
                            "ref(?:erence)?\\.?[:\\s]*([A-Z0-9][A-Z0-9\\-/]*)"),
                    field("engineerRegistration", true, null,
                            "gas\\s*safe\\s*(?:reg(?:istration)?|id|no|number)?\\.?[:\\s]*(\\d{6,7})",
                            "registration\\s*(?:no|number)?\\.?[:\\s]*(\\d{6,7})"),
                    field("engineerName", false, String::trim,
                            "engineer(?:\\s*name)?[:\\s]+([A-Za-z][A-Za-z .'-]+?)\\s*(?:gas|$|\\n)",
                            "technician[:\\s]+([A-Za-z][A-Za-z .'-]+?)\\s*(?:gas|$|\\n)"),
                    field("inspectionDate", true, DATE,
                            "inspection\\s*date[:\\s]*([\\d/\\-.]+)",
                            "date\\s*of\\s*inspection[:\\s]*([\\d/\\-.]+)",
                            "date[:\\s]*([\\d/\\-.]+)"),
                    field("expiryDate", false, DATE,
                            "expiry\\s*date[:\\s]*([\\d/\\-.]+)",
                            "next\\s*inspection\\s*(?:due\\s*)?(?:by\\s*)?[:\\s]*([\\d/\\-.]+)",
                            "valid\\s*until[:\\s]*([\\d/\\-.]+)"),
                    field("propertyAddress", false, String::trim,
                            "property\\s*address[:\\s]*([^\\n]+)",
                            "address[:\\s]*([^\\n]+)"),
                    field("outcome", false, GAS_OUTCOME,
                            "overall\\s*(?:result|outcome)[:\\s]*(satisfactory|unsatisfactory|pass|fail)",
                            "certificate\\s*(?:is\\s*)?(satisfactory|unsatisfactory)")),
            "EICR", List.of(
                    field("certificateNumber", true, null,
                            "certificate\\s*(?:number|no|ref)\\.?[:\\s]*([A-Z0-9][A-Z0-9\\-/]*)",
                            "report\\s*(?:reference|ref|number|no)\\.?[:\\s]*([A-Z0-9][A-Z0-9\\-/]*)"),
                    field("engineerRegistration", false, null,
                            "niceic\\s*(?:reg(?:istration)?|no|number)?\\.?[:\\s]*(\\d+)",
                            "napit\\s*(?:reg(?:istration)?|no|number)?\\.?[:\\s]*(\\d+)",
                            "elecsa\\s*(?:reg(?:istration)?|no|number)?\\.?[:\\s]*(\\d+)",
                            "registration\\s*(?:no|number)?\\.?[:\\s]*(\\d+)"),
                    field("engineerName", false, String::trim,
                            "inspector[:\\s]+([A-Za-z][A-Za-z .'-]+?)\\s*(?:niceic|$|\\n)",
                            "electrician[:\\s]+([A-Za-z][A-Za-z .'-]+?)\\s*(?:reg|$|\\n)"),
                    field("inspectionDate", true, DATE,
                            "inspection\\s*date[:\\s]*([\\d/\\-.]+)",
                            "date\\s*of\\s*(?:inspection|report)[:\\s]*([\\d/\\-.]+)"),
                    field("expiryDate", false, DATE,
                            "next\\s*inspection\\s*(?:due\\s*)?(?:by\\s*)?[:\\s]*([\\d/\\-.]+)",
                            "recommend(?:ed)?\\s*(?:re-?)?inspection[:\\s]*([\\d/\\-.]+)"),
                    field("propertyAddress", false, String::trim,
                            "(?:installation|property)\\s*address[:\\s]*([^\\n]+)"),
                    field("outcome", false, EICR_OUTCOME,
                            "overall\\s*(?:condition|assessment)[:\\s]*(satisfactory|unsatisfactory)",
                            "the\\s*installation\\s*is[:\\s]*(satisfactory|unsatisfactory)")),
            "EPC", List.of(
                    field("certificateNumber", true, null,
                            "certificate\\s*(?:reference|number)[:\\s]*([A-Z0-9][A-Z0-9\\-]*)",
                            "RRN[:\\s]*([A-Z0-9][A-Z0-9\\-]*)"),
                    field("inspectionDate", false, DATE,
                            "date\\s*of\\s*assessment[:\\s]*([\\d/\\-.]+)",
                            "assessment\\s*date[:\\s]*([\\d/\\-.]+)"),
                    field("expiryDate", false, DATE,
                            "valid\\s*until[:\\s]*([\\d/\\-.]+)",
                            "expiry\\s*date[:\\s]*([\\d/\\-.]+)"),
                    field("energyRating", false, UPPER,
                            "energy\\s*(?:efficiency\\s*)?rating[:\\s]*([A-G])\\b",
                            "current\\s*rating[:\\s]*([A-G])\\b")),
            "FRA", List.of(
                    field("certificateNumber", false, null,
                            "assessment\\s*(?:reference|ref|number)[:\\s]*([A-Z0-9][A-Z0-9\\-]*)",
                            "report\\s*(?:reference|ref|number)[:\\s]*([A-Z0-9][A-Z0-9\\-]*)"),
                    field("inspectionDate", true, DATE,
                            "date\\s*of\\s*assessment[:\\s]*([\\d/\\-.]+)",
                            "assessment\\s*date[:\\s]*([\\d/\\-.]+)"),
                    field("expiryDate", false, DATE,
                            "review\\s*date[:\\s]*([\\d/\\-.]+)",
                            "next\\s*review[:\\s]*([\\d/\\-.]+)"),
                    field("riskRating", false, UPPER,
                            "overall\\s*risk\\s*(?:rating|level)?[:\\s]*(trivial|tolerable|moderate|substantial|intolerable)",
                            "risk\\s*rating[:\\s]*(low|medium|high|very\\s*high)"))
    );

    private static final List<DefectCode> DEFECT_CODES = List.of(
            defect("C1", DefectPriority.IMMEDIATE, "\\bC1\\b", "(?i)code\\s*1\\b", "(?i)danger\\s*present"),
            defect("C2", DefectPriority.URGENT, "\\bC2\\b", "(?i)code\\s*2\\b", "(?i)potentially\\s*dangerous"),
            defect("C3", DefectPriority.ADVISORY, "\\bC3\\b", "(?i)code\\s*3\\b", "(?i)improvement\\s*recommended"),
            defect("FI", DefectPriority.URGENT, "\\bFI\\b", "(?i)further\\s*investigation"),
            defect("AR", DefectPriority.URGENT, "\\bAR\\b", "(?i)at\\s*risk"),
            defect("ID", DefectPriority.IMMEDIATE, "\\bID\\b", "(?i)immediately\\s*dangerous"),
            defect("NCS", DefectPriority.ADVISORY, "\\bNCS\\b", "(?i)not\\s*to\\s*current\\s*standard")
    );

    private static final Pattern APPLIANCE_LINE = Pattern.compile("appliance\\s*\\d*[:\\s]+([^\\n]+)", CI);
    private static final Pattern APPLIANCE_OUTCOME = Pattern.compile("\\b(pass|fail|satisfactory|unsatisfactory)\\b", CI);

    public boolean supports(String certificateType, CustomPatternConfig custom) {
        return BUILT_IN.containsKey(certificateType) || (custom != null && !custom.fieldPatterns().isEmpty());
    }

    /**
     * Custom patterns for a field are tried before the built-in ones; custom-only fields are appended.
     */
    public List<FieldPattern> patternsFor(String certificateType, CustomPatternConfig custom) {
        Map<String, FieldPattern> merged = new LinkedHashMap<>();
        for (FieldPattern builtIn : BUILT_IN.getOrDefault(certificateType, List.of())) {
            merged.put(builtIn.field(), builtIn);
        }
        if (custom == null) {
            return List.copyOf(merged.values());
        }

        custom.fieldPatterns().forEach((fieldName, regexes) -> {
            List<Pattern> compiled = compileCustom(certificateType, fieldName, regexes);
            if (compiled.isEmpty()) return;
            FieldPattern existing = merged.get(fieldName);
            List<Pattern> patterns = new ArrayList<>(compiled);
            UnaryOperator<String> transform = null;
            if (existing != null) {
                patterns.addAll(existing.patterns());
                transform = existing.transform();
            } else if (fieldName.toLowerCase(Locale.ROOT).endsWith("date")) {
                transform = DATE;
            }
            boolean required = custom.requiredFields().contains(fieldName) || (existing != null && existing.required());
            merged.put(fieldName, new FieldPattern(fieldName, List.copyOf(patterns), transform, required));
        });
        return List.copyOf(merged.values());
    }

    public List<DefectRecord> extractDefects(String text) {
        List<DefectRecord> defects = new ArrayList<>();
        for (String line : text.split("\\R")) {
            for (DefectCode code : DEFECT_CODES) {
                if (code.patterns().stream().anyMatch(p -> p.matcher(line).find())) {
                    defects.add(new DefectRecord(code.code(), line.trim(), null, code.priority()));
                }
            }
        }
        return defects;
    }

    /**
     * Appliance lines are only itemised on gas certificates. Each entry is (description, outcome code).
     */
    public List<String[]> extractGasAppliances(String text) {
        List<String[]> appliances = new ArrayList<>();
        Matcher m = APPLIANCE_LINE.matcher(text);
        while (m.find()) {
            String line = m.group(1).trim();
            Matcher outcome = APPLIANCE_OUTCOME.matcher(line);
            String code = null;
            if (outcome.find()) {
                String upper = outcome.group(1).toUpperCase(Locale.ROOT);
                code = upper.equals("PASS") || upper.equals("SATISFACTORY") ? "PASS" : "FAIL";
            }
            appliances.add(new String[]{line, code});
        }
        return appliances;
    }

    private List<Pattern> compileCustom(String certificateType, String fieldName, List<String> regexes) {
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : regexes == null ? List.<String>of() : regexes) {
            try {
                compiled.add(Pattern.compile(regex, CI));
            } catch (PatternSyntaxException e) {
                log.warn("[Template] Ignoring invalid custom pattern for {}.{}: {}", certificateType, fieldName, e.getDescription());
            }
        }
        return compiled;
    }

    private static FieldPattern field(String name, boolean required, UnaryOperator<String> transform, String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, CI));
        }
        return new FieldPattern(name, List.copyOf(patterns), transform, required);
    }

    private static DefectCode defect(String code, DefectPriority priority, String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex));
        }
        return new DefectCode(code, priority, List.copyOf(patterns));
    }
}
