package tech.adaptivepool.config;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import tech.adaptivepool.unit.UnitFactory;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PoolConfigTest {

    @SuppressWarnings("unchecked")
    private final UnitFactory<String, String> factory = mock(UnitFactory.class);

    @Test
    void builderAppliesDefaults() {
        PoolConfig<String, String> config = PoolConfig.builder("defaults", factory).build();

        assertEquals("defaults", config.name());
        assertEquals(2, config.minUnits());
        assertEquals(Math.max(2, Runtime.getRuntime().availableProcessors()), config.maxUnits());
        assertEquals(5, config.scaleUpThreshold());
        assertEquals(0, config.scaleDownThreshold());
        assertEquals(1000, config.coolDownMs());
        assertEquals(1000, config.checkIntervalMs());
        assertEquals(3, config.maxRestartsPerSlot());
        assertEquals(5000, config.shutdownGraceMs());
        assertFalse(config.isQueueBounded());
        assertFalse(config.hasTaskTimeout());
        assertNull(config.rateLimitPerMinute());
    }

    @Test
    void maxUnitsBelowMinUnitsIsRejected() {
        PoolConfig.Builder<String, String> builder = PoolConfig.builder("bad", factory).minUnits(4).maxUnits(3);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("maxUnits"));
    }

    @Test
    void zeroMaxUnitsIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> PoolConfig.builder("bad", factory).minUnits(0).maxUnits(0).build());
    }

    @Test
    void negativeValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> PoolConfig.builder("bad", factory).minUnits(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> PoolConfig.builder("bad", factory).coolDownMs(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> PoolConfig.builder("bad", factory).checkIntervalMs(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> PoolConfig.builder("bad", factory).queueCapacity(-5).build());
        assertThrows(IllegalArgumentException.class,
            () -> PoolConfig.builder("bad", factory).maxRestartsPerSlot(-1).build());
    }

    @Test
    void blankNameAndMissingFactoryAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.builder(" ", factory).build());
        assertThrows(NullPointerException.class, () -> PoolConfig.<String, String>builder("x", null).build());
    }

    @Test
    void nonPositiveRateLimitMeansNoLimit() {
        PoolConfig<String, String> config = PoolConfig.builder("limited", factory).rateLimitPerMinute(0).build();

        assertNull(config.rateLimitPerMinute());
    }

    @Test
    void fromJsonReadsEveryKey() {
        JsonObject json = new JsonObject()
            .put("name", "thumbnails")
            .put("minUnits", 1)
            .put("maxUnits", 6)
            .put("scaleUpThreshold", 10)
            .put("scaleDownThreshold", 2)
            .put("coolDownMs", 2500)
            .put("checkIntervalMs", 200)
            .put("maxRestartsPerSlot", 5)
            .put("queueCapacity", 100)
            .put("taskTimeoutMs", 30000)
            .put("killOnTimeout", true)
            .put("shutdownGraceMs", 750)
            .put("rateLimitPerMinute", 600);

        PoolConfig<String, String> config = PoolConfig.fromJson(json, factory);

        assertEquals("thumbnails", config.name());
        assertEquals(1, config.minUnits());
        assertEquals(6, config.maxUnits());
        assertEquals(10, config.scaleUpThreshold());
        assertEquals(2, config.scaleDownThreshold());
        assertEquals(2500, config.coolDownMs());
        assertEquals(200, config.checkIntervalMs());
        assertEquals(5, config.maxRestartsPerSlot());
        assertEquals(100, config.queueCapacity());
        assertEquals(30000, config.taskTimeoutMs());
        assertTrue(config.killOnTimeout());
        assertEquals(750, config.shutdownGraceMs());
        assertEquals(600, config.rateLimitPerMinute());
        assertSame(factory, config.unitFactory());
    }

    @Test
    void fromJsonFallsBackToDefaults() {
        PoolConfig<String, String> config = PoolConfig.fromJson(new JsonObject().put("maxUnits", 4), factory);

        assertEquals("default", config.name());
        assertEquals(2, config.minUnits());
        assertEquals(4, config.maxUnits());
        assertEquals(5, config.scaleUpThreshold());
    }

    @Test
    void toJsonRoundTripsThroughFromJson() {
        PoolConfig<String, String> original = PoolConfig.builder("roundtrip", factory)
            .minUnits(3)
            .maxUnits(9)
            .taskTimeoutMs(1500)
            .rateLimitPerMinute(120)
            .build();

        PoolConfig<String, String> copy = PoolConfig.fromJson(original.toJson(), factory);

        assertEquals(original, copy);
    }

    @Test
    void toBuilderKeepsValues() {
        PoolConfig<String, String> original = PoolConfig.builder("copy", factory).minUnits(1).maxUnits(2).build();

        PoolConfig<String, String> widened = original.toBuilder().maxUnits(5).build();

        assertEquals(1, widened.minUnits());
        assertEquals(5, widened.maxUnits());
        assertEquals(original.coolDownMs(), widened.coolDownMs());
    }
}
