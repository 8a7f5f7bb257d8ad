package org.namix.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredValueTest {

    @Test
    @DisplayName("EXPLICIT 는 모든 출처를 덮어쓴다")
    void explicitOverridesEverything() {
        assertThat(ConfigurationSource.EXPLICIT.overrides(null)).isTrue();
        assertThat(ConfigurationSource.EXPLICIT.overrides(ConfigurationSource.CONVENTION)).isTrue();
        assertThat(ConfigurationSource.EXPLICIT.overrides(ConfigurationSource.EXPLICIT)).isTrue();
    }

    @Test
    @DisplayName("CONVENTION 은 CONVENTION 이나 부재만 덮어쓴다")
    void conventionOverridesOnlyConvention() {
        assertThat(ConfigurationSource.CONVENTION.overrides(null)).isTrue();
        assertThat(ConfigurationSource.CONVENTION.overrides(ConfigurationSource.CONVENTION)).isTrue();
        assertThat(ConfigurationSource.CONVENTION.overrides(ConfigurationSource.EXPLICIT)).isFalse();
    }

    @Test
    @DisplayName("거부된 merge 는 기존 인스턴스를 그대로 반환한다")
    void refusedMergeKeepsCurrent() {
        ConfiguredValue explicit = new ConfiguredValue("Customers", ConfigurationSource.EXPLICIT);

        ConfiguredValue merged = ConfiguredValue.merge(explicit, "customer", ConfigurationSource.CONVENTION);

        assertThat(merged).isSameAs(explicit);
    }

    @Test
    @DisplayName("허용된 merge 는 새 값과 출처를 가진다")
    void acceptedMerge() {
        ConfiguredValue convention = new ConfiguredValue("customer", ConfigurationSource.CONVENTION);

        ConfiguredValue merged = ConfiguredValue.merge(convention, "Customers", ConfigurationSource.EXPLICIT);

        assertThat(merged.value()).isEqualTo("Customers");
        assertThat(merged.isExplicit()).isTrue();
        assertThat(merged.isConventional()).isFalse();
    }

    @Test
    @DisplayName("canRemove 는 출처 우선순위를 따른다")
    void canRemove() {
        ConfiguredValue explicit = new ConfiguredValue("Customers", ConfigurationSource.EXPLICIT);

        assertThat(ConfiguredValue.canRemove(null, ConfigurationSource.CONVENTION)).isTrue();
        assertThat(ConfiguredValue.canRemove(explicit, ConfigurationSource.CONVENTION)).isFalse();
        assertThat(ConfiguredValue.canRemove(explicit, ConfigurationSource.EXPLICIT)).isTrue();
    }

    @Test
    @DisplayName("출처는 null 일 수 없다")
    void sourceRequired() {
        assertThatThrownBy(() -> new ConfiguredValue("x", null))
                .isInstanceOf(NullPointerException.class);
    }
}
