package com.dtsxarchitect.core.graph;

import com.dtsxarchitect.core.model.ControlFlowStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StageResolver}. Each tier is exercised on its own before the combined lookup.
 */
class StageResolverTest {

    private final List<ControlFlowStage> stages = List.of(
        stage(1, "Load", "Package\\Load"),
        stage(2, "Load Customers", ""),
        stage(3, "Archive", "Package\\Archive"));

    private final StageResolver resolver = new StageResolver(stages);

    @Test
    void byRefId_matchesExactReferenceOnly() {
        assertThat(resolver.byRefId("Package\\Archive")).contains(2);
        assertThat(resolver.byRefId("Package\\Archive\\Inner")).isEmpty();
    }

    @Test
    void byLastSegment_matchesStageNameAfterSeparator() {
        assertThat(resolver.byLastSegment("Package\\Load Customers")).contains(1);
        assertThat(resolver.byLastSegment("Package/Load Customers")).contains(1);
        assertThat(resolver.byLastSegment("Package\\Missing")).isEmpty();
    }

    @Test
    void byContainment_prefersLongestContainedName() {
        assertThat(resolver.byContainment("{Load Customers v2}")).contains(1);
        assertThat(resolver.byContainment("Reload")).isEmpty();
    }

    @Test
    void resolve_triesTiersInOrder() {
        assertThat(resolver.resolve("Package\\Load")).contains(0);
        assertThat(resolver.resolve("Other\\Load Customers")).contains(1);
        assertThat(resolver.resolve("Package.Executables[Archive]")).contains(2);
        assertThat(resolver.resolve("Package\\Nothing")).isEmpty();
        assertThat(resolver.resolve("")).isEmpty();
        assertThat(resolver.resolve(null)).isEmpty();
    }

    static ControlFlowStage stage(int order, String name, String refId) {
        return new ControlFlowStage(order, name, refId, "SqlTask", null, null, List.of(), List.of(), List.of(), null);
    }
}
