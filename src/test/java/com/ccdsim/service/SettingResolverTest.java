package com.ccdsim.service;

import com.ccdsim.model.Direction;
import com.ccdsim.model.Effect;
import com.ccdsim.model.HeaderIssue;
import com.ccdsim.model.ParameterKey;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SettingResolverTest {

    @Test
    void overrideBeatsPrimaryBeatsAlternateBeatsDefault() {
        Map<String, Object> header = new HashMap<>();
        header.put("CAMNUM", 3);
        header.put("CAMERA", 2);
        KeywordSource both = new MapKeywordSource(header);
        KeywordSource alternateOnly = new MapKeywordSource(Collections.singletonMap("CAMERA", 2));

        assertThat(SettingResolver.resolve(ParameterKey.CAMERA_NUMBER, Direction.RAW, "4", both)).isEqualTo(4);
        assertThat(SettingResolver.resolve(ParameterKey.CAMERA_NUMBER, Direction.RAW, null, both)).isEqualTo(3);
        assertThat(SettingResolver.resolve(ParameterKey.CAMERA_NUMBER, Direction.RAW, null, alternateOnly))
                .isEqualTo(2);
        assertThat(SettingResolver.resolve(ParameterKey.CAMERA_NUMBER, Direction.RAW, null, KeywordSource.empty()))
                .isEqualTo(1);
    }

    @Test
    void flagDefaultsDependOnDirection() {
        assertThat(SettingResolver.resolve(Effect.SHOT_NOISE, Direction.RAW, null, KeywordSource.empty()))
                .isEqualTo(true);
        assertThat(SettingResolver.resolve(Effect.SHOT_NOISE, Direction.ELECTRON_FLUX, null, KeywordSource.empty()))
                .isEqualTo(false);
        assertThat(SettingResolver.resolve(Effect.SHOT_NOISE, Direction.RAW, null,
                new MapKeywordSource(Collections.singletonMap("SHOTPRS", false)))).isEqualTo(false);
    }

    @Test
    void listsAreReadFromIndexedKeywords() {
        Map<String, Object> header = new HashMap<>();
        header.put("VSCALE1", 5.5);
        header.put("VSCALE2", 5.25);
        header.put("VSCALE4", 9.0);

        Object scales = SettingResolver.resolve(ParameterKey.VIDEO_SCALES, Direction.RAW, null,
                new MapKeywordSource(header));

        assertThat(scales).isEqualTo(Arrays.asList(5.5, 5.25));
    }

    @Test
    void bareListKeywordIsAccepted() {
        Object scales = SettingResolver.resolve(ParameterKey.VIDEO_SCALES, Direction.RAW, null,
                new MapKeywordSource(Collections.singletonMap("VSCALE", "5.5, 5.0")));

        assertThat(scales).isEqualTo(Arrays.asList(5.5, 5.0));
    }

    @Test
    void rawFramesWithoutReadCountAreReported() {
        List<HeaderIssue> missing = SettingResolver.inspect(ParameterKey.NUMBER_OF_EXPOSURES, Direction.RAW, null,
                KeywordSource.empty());
        List<HeaderIssue> alternate = SettingResolver.inspect(ParameterKey.NUMBER_OF_EXPOSURES, Direction.RAW, null,
                new MapKeywordSource(Collections.singletonMap("NUMEXP", 20)));
        List<HeaderIssue> electronFlux = SettingResolver.inspect(ParameterKey.NUMBER_OF_EXPOSURES,
                Direction.ELECTRON_FLUX, null, KeywordSource.empty());
        List<HeaderIssue> overridden = SettingResolver.inspect(ParameterKey.NUMBER_OF_EXPOSURES, Direction.RAW, 20,
                KeywordSource.empty());

        assertThat(missing).containsExactly(new HeaderIssue(HeaderIssue.Kind.MISSING_REQUIRED,
                "number_of_exposures", "NREADS"));
        assertThat(alternate).isEmpty();
        assertThat(electronFlux).isEmpty();
        assertThat(overridden).isEmpty();
    }

    @Test
    void gainKeywordIsReportedAsForbidden() {
        List<HeaderIssue> issues = SettingResolver.inspect(ParameterKey.VIDEO_SCALES, Direction.RAW, null,
                new MapKeywordSource(Collections.singletonMap("GAIN", 1.8)));

        assertThat(issues).containsExactly(new HeaderIssue(HeaderIssue.Kind.FORBIDDEN_PRESENT,
                "video_scales", "GAIN"));
        assertThat(issues.get(0).toString()).contains("GAIN").contains("video_scales");
    }

    @Test
    void resolveAllCollectsParametersFlagsAndIssues() {
        Map<String, Object> header = new HashMap<>();
        header.put("NUMSLICE", 2);
        header.put("INADU", false);
        header.put("GAIN", 2.0);
        SettingsOverrides overrides = SettingsOverrides.parse(Collections.singletonMap("smear_rows", 4));

        ResolvedSettings settings = SettingResolver.resolveAll(Direction.RAW, overrides,
                new MapKeywordSource(header));

        assertThat(settings.getParameters().getNumberOfSlices()).isEqualTo(2);
        assertThat(settings.getParameters().getSmearRows()).isEqualTo(4);
        assertThat(settings.getFlags().isInAdu()).isFalse();
        assertThat(settings.getFlags().isBaselinePresent()).isTrue();
        assertThat(settings.getIssues()).extracting(issue -> issue.kind)
                .containsExactlyInAnyOrder(HeaderIssue.Kind.MISSING_REQUIRED, HeaderIssue.Kind.FORBIDDEN_PRESENT);
    }

    @Test
    void headerValuesOfTheWrongTypeAreRejected() {
        KeywordSource source = new MapKeywordSource(Collections.singletonMap("FULLWELL", "lots"));

        assertThatThrownBy(() -> SettingResolver.resolve(ParameterKey.FULL_WELL, Direction.RAW, null, source))
                .hasMessageStartingWith("INVALID_VALUE")
                .hasMessageContaining("full_well");
    }
}
