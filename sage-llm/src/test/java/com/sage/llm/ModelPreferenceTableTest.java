package com.sage.llm;

import com.sage.model.ModelTier;
import com.sage.model.PrivacyMode;
import com.sage.model.TaskComplexity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelPreferenceTableTest {

    @Test
    void defaultTableNeverOffersCloudUnderLocalOnly() {
        ModelPreferenceTable table = ModelPreferenceTable.loadDefault();
        for (TaskComplexity complexity : TaskComplexity.values()) {
            List<ModelTier> tiers = table.preferences(PrivacyMode.LOCAL_ONLY, complexity);
            assertFalse(tiers.isEmpty(), "no tiers for " + complexity);
            assertTrue(tiers.stream().allMatch(ModelTier::isLocal), complexity + " -> " + tiers);
        }
    }

    @Test
    void defaultTableOrdersCloudFirstForComplexCloudAllowedTasks() {
        ModelPreferenceTable table = ModelPreferenceTable.loadDefault();
        assertEquals(List.of(ModelTier.CLOUD_BEST, ModelTier.LOCAL_POWERFUL),
                table.preferences(PrivacyMode.CLOUD_ALLOWED, TaskComplexity.HIGH));
        assertEquals(List.of(ModelTier.LOCAL_POWERFUL, ModelTier.CLOUD_BEST),
                table.preferences(PrivacyMode.HYBRID, TaskComplexity.HIGH));
    }

    @Test
    void rejectsCloudTierConfiguredUnderLocalOnly() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new ModelPreferenceTable(
                Map.of(PrivacyMode.LOCAL_ONLY, Map.of(TaskComplexity.HIGH, List.of(ModelTier.CLOUD_BEST)))));
        assertTrue(e.getMessage().contains("cloud-best"));
    }

    @Test
    void fromJsonAcceptsEnumNamesAndIds() {
        ModelPreferenceTable table = ModelPreferenceTable.fromJson(
                "{\"hybrid\": {\"low\": [\"LOCAL_FAST\", \"cloud-best\"]}}");
        assertEquals(List.of(ModelTier.LOCAL_FAST, ModelTier.CLOUD_BEST),
                table.preferences(PrivacyMode.HYBRID, TaskComplexity.LOW));
        assertTrue(table.preferences(PrivacyMode.LOCAL_ONLY, TaskComplexity.LOW).isEmpty());
    }
}
