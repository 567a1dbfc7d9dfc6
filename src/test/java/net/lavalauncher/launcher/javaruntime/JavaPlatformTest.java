package net.lavalauncher.launcher.javaruntime;

import net.lavalauncher.launcher.utils.OsType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JavaPlatformTest {
    @ParameterizedTest
    @CsvSource(textBlock = """
            amd64,x64
            x86_64,x64
            aarch64,aarch64
            arm64,aarch64
            arm,arm
            armv7l,arm
            """)
    void testArchitectureMapping(String osArch, String expected) {
        assertThat(JavaPlatform.mapArchitecture(osArch)).isEqualTo(expected);
    }

    @Test
    void testArchiveExtensionPerOs() throws Exception {
        assertThat(JavaPlatform.of(OsType.WINDOWS, "amd64")).isEqualTo(new JavaPlatform("windows", "x64", "zip"));
        assertThat(JavaPlatform.of(OsType.LINUX, "amd64")).isEqualTo(new JavaPlatform("linux", "x64", "tar.gz"));
        assertThat(JavaPlatform.of(OsType.MAC, "aarch64")).isEqualTo(new JavaPlatform("mac", "aarch64", "tar.gz"));
    }

    @Test
    void testUnknownOs() {
        assertThrows(UnsupportedPlatformException.class, () -> JavaPlatform.of(OsType.UNKNOWN, "amd64"));
    }

    @Test
    void testInstallationName() {
        assertThat(new JavaPlatform("linux", "x64", "tar.gz").getInstallationName(17)).isEqualTo("17-linux-x64");
    }
}
