package net.lavalauncher.launcher.launch;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LaunchSettingsTest {
    @ParameterizedTest
    @ValueSource(strings = {"4G", "512m", "1024", "65536k"})
    void testValidMemorySizes(String size) {
        assertThat(new LaunchSettings(size, size).maxMemory()).isEqualTo(size);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "4 GB", "G", "-1G", "1.5G"})
    void testInvalidMemorySizes(String size) {
        assertThrows(IllegalArgumentException.class, () -> new LaunchSettings(size, "2G"));
    }
}
