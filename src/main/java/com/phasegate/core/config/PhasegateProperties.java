package com.phasegate.core.config;

import com.phasegate.core.attestation.StructuralDriftClassifier;
import com.phasegate.core.evidence.EvidenceRequirement;
import com.phasegate.core.model.Phase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "phasegate")
public class PhasegateProperties {

    private Telemetry telemetry = new Telemetry();
    private Ledger ledger = new Ledger();
    private Enforcement enforcement = new Enforcement();
    private Evidence evidence = new Evidence();
    private Attestation attestation = new Attestation();
    private Lease lease = new Lease();

    public Telemetry getTelemetry() { return telemetry; }
    public void setTelemetry(Telemetry telemetry) { this.telemetry = telemetry; }
    public Ledger getLedger() { return ledger; }
    public void setLedger(Ledger ledger) { this.ledger = ledger; }
    public Enforcement getEnforcement() { return enforcement; }
    public void setEnforcement(Enforcement enforcement) { this.enforcement = enforcement; }
    public Evidence getEvidence() { return evidence; }
    public void setEvidence(Evidence evidence) { this.evidence = evidence; }
    public Attestation getAttestation() { return attestation; }
    public void setAttestation(Attestation attestation) { this.attestation = attestation; }
    public Lease getLease() { return lease; }
    public void setLease(Lease lease) { this.lease = lease; }

    public static class Telemetry {
        private boolean enabled = true;
        private String dir = "state/telemetry";
        private String spansFile = "traces.jsonl";
        private String countersFile = "counters.jsonl";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public String getSpansFile() { return spansFile; }
        public void setSpansFile(String spansFile) { this.spansFile = spansFile; }
        public String getCountersFile() { return countersFile; }
        public void setCountersFile(String countersFile) { this.countersFile = countersFile; }
    }

    public static class Ledger {
        private boolean enabled = false;
        private String path = "state/process/ledger.jsonl";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class Enforcement {
        private Duration advanceTimeout = Duration.ofSeconds(30);
        private int gateThreads = 4;

        public Duration getAdvanceTimeout() { return advanceTimeout; }
        public void setAdvanceTimeout(Duration advanceTimeout) { this.advanceTimeout = advanceTimeout; }
        public int getGateThreads() { return gateThreads; }
        public void setGateThreads(int gateThreads) { this.gateThreads = gateThreads; }
    }

    public static class Evidence {
        /** Keyed by phase name, case-insensitive. */
        private Map<String, Requirement> requirements = new LinkedHashMap<>();

        public Map<String, Requirement> getRequirements() { return requirements; }
        public void setRequirements(Map<String, Requirement> requirements) { this.requirements = requirements; }

        /**
         * @throws com.phasegate.core.model.InvalidPhaseException when a key is not a phase name
         */
        public Map<Phase, EvidenceRequirement> toRequirements() {
            var result = new EnumMap<Phase, EvidenceRequirement>(Phase.class);
            requirements.forEach((name, r) -> result.put(Phase.parse(name),
                    new EvidenceRequirement(r.getMinTests(), r.getMinCalls(), r.getMinArtifacts())));
            return result;
        }
    }

    public static class Requirement {
        private int minTests;
        private int minCalls;
        private int minArtifacts;

        public int getMinTests() { return minTests; }
        public void setMinTests(int minTests) { this.minTests = minTests; }
        public int getMinCalls() { return minCalls; }
        public void setMinCalls(int minCalls) { this.minCalls = minCalls; }
        public int getMinArtifacts() { return minArtifacts; }
        public void setMinArtifacts(int minArtifacts) { this.minArtifacts = minArtifacts; }
    }

    public static class Attestation {
        private String instructionsDir = "state/instructions";
        private List<String> guardrailKeywords = new ArrayList<>(StructuralDriftClassifier.DEFAULT_GUARDRAILS);
        private List<String> commentPrefixes = new ArrayList<>(StructuralDriftClassifier.DEFAULT_COMMENT_PREFIXES);

        public String getInstructionsDir() { return instructionsDir; }
        public void setInstructionsDir(String instructionsDir) { this.instructionsDir = instructionsDir; }
        public List<String> getGuardrailKeywords() { return guardrailKeywords; }
        public void setGuardrailKeywords(List<String> guardrailKeywords) { this.guardrailKeywords = guardrailKeywords; }
        public List<String> getCommentPrefixes() { return commentPrefixes; }
        public void setCommentPrefixes(List<String> commentPrefixes) { this.commentPrefixes = commentPrefixes; }
    }

    public static class Lease {
        private boolean enabled = false;
        private Duration duration = Duration.ofMinutes(5);
        private int maxRenewals = 10;
        /** Agent id for callers that name none; generated when blank. */
        private String holder = "";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getDuration() { return duration; }
        public void setDuration(Duration duration) { this.duration = duration; }
        public int getMaxRenewals() { return maxRenewals; }
        public void setMaxRenewals(int maxRenewals) { this.maxRenewals = maxRenewals; }
        public String getHolder() { return holder; }
        public void setHolder(String holder) { this.holder = holder; }
    }
}
