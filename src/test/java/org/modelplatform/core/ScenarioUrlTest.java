package org.modelplatform.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.modelplatform.api.exceptions.ValidationException;

@Tag("unit")
class ScenarioUrlTest {

    @Test
    void parsesFullUrl() {
        ScenarioUrl url = ScenarioUrl.parse("ixmp://local/canning/standard#3");

        assertThat(url).isEqualTo(new ScenarioUrl("local", "canning", "standard", 3, false));
        assertThat(url.format()).isEqualTo("ixmp://local/canning/standard#3");
        assertThat(url.path()).isEqualTo("canning/standard#3");
    }

    @Test
    void bareFormHasNoPlatform() {
        ScenarioUrl url = ScenarioUrl.parse("canning/standard");

        assertThat(url.platform()).isNull();
        assertThat(url.version()).isNull();
        assertThat(url.isNew()).isFalse();
        assertThat(url.format()).isEqualTo("canning/standard");
    }

    @Test
    void scenarioNameMayContainSlashes() {
        ScenarioUrl url = ScenarioUrl.parse("ixmp://p/m/baseline/high/2050#new");

        assertThat(url.model()).isEqualTo("m");
        assertThat(url.scenario()).isEqualTo("baseline/high/2050");
        assertThat(url.isNew()).isTrue();
        assertThat(url.version()).isNull();
        assertThat(url.path()).isEqualTo("m/baseline/high/2050#new");
    }

    @Test
    void emptySchemeIsAccepted() {
        assertThat(ScenarioUrl.parse("://p/m/s#0").version()).isZero();
    }

    @Test
    void queryIsRejected() {
        assertThatThrownBy(() -> ScenarioUrl.parse("ixmp://p/m/s?version=2"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("URL query is not supported");
    }

    @Test
    void foreignSchemeIsRejected() {
        assertThatThrownBy(() -> ScenarioUrl.parse("http://p/m/s"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'http'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"m", "m/", "/s", "ixmp://p/m", "ixmp://p"})
    void pathNeedsModelAndScenario(String url) {
        assertThatThrownBy(() -> ScenarioUrl.parse(url))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("URL path must be 'MODEL/SCENARIO'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"m/s#-1", "m/s#latest", "m/s#1.5"})
    void versionMustBeIntegerOrNew(String url) {
        assertThatThrownBy(() -> ScenarioUrl.parse(url))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("URL version must be int or 'new'");
    }
}
