package com.spicenet.core.netlist;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DeviceModel} and {@link ModelType}.
 */
class DeviceModelTest {

    @Test
    void toSpice_rendersParametersInOrder() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("bf", 100);
        parameters.put("is", "1e-16");
        parameters.put("vaf", 75.5);

        DeviceModel model = new DeviceModel("q2n2222", ModelType.NPN, parameters);

        assertThat(model.toSpice()).isEqualTo(".model q2n2222 NPN (bf=100, is=1e-16, vaf=75.5)");
    }

    @Test
    void constructor_copiesParameters() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("vto", -1);
        DeviceModel model = new DeviceModel("jmod", ModelType.NJF, parameters);

        parameters.put("beta", 1e-4);

        assertThat(model.parameters()).containsOnlyKeys("vto");
        assertThatThrownBy(() -> model.parameters().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructor_invalidNameOrValue_throwsException() {
        assertThatThrownBy(() -> new DeviceModel("my model", ModelType.D, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("is", null);
        assertThatThrownBy(() -> new DeviceModel("dmod", ModelType.D, withNull))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("is");
    }

    @Test
    void fromCode_isCaseInsensitive() {
        assertThat(ModelType.fromCode("nmos")).isEqualTo(ModelType.NMOS);
        assertThat(ModelType.fromCode(" csw ")).isEqualTo(ModelType.CSW);
        assertThatThrownBy(() -> ModelType.fromCode("BJT"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("BJT");
    }
}
