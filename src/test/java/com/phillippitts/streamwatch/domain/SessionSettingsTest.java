package com.phillippitts.streamwatch.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionSettingsTest {

    @Test
    void defaultsAreFullHdOnBackCamera() {
        SessionSettings s = SessionSettings.defaults();

        assertThat(s.video().width()).isEqualTo(1920);
        assertThat(s.video().height()).isEqualTo(1080);
        assertThat(s.video().bitrateBps()).isEqualTo(4_000_000);
        assertThat(s.audio().bitrateBps()).isEqualTo(128_000);
        assertThat(s.facing()).isEqualTo(CameraFacing.BACK);
    }

    @Test
    void portraitResolutionIsNormalizedToLandscape() {
        SessionSettings.Video portrait = new SessionSettings.Video(720, 1280, 1500, 30, VideoCodec.H264, 2,
                VideoRotation.ROTATION_90);

        assertThat(portrait.landscapeWidth()).isEqualTo(1280);
        assertThat(portrait.landscapeHeight()).isEqualTo(720);
    }

    @Test
    void withersReplaceOnePart() {
        SessionSettings s = SessionSettings.defaults();

        SessionSettings front = s.withFacing(CameraFacing.FRONT);

        assertThat(front.facing()).isEqualTo(CameraFacing.FRONT);
        assertThat(front.video()).isEqualTo(s.video());
        assertThat(CameraFacing.FRONT.opposite()).isEqualTo(CameraFacing.BACK);
    }

    @Test
    void rejectsInvalidVideo() {
        assertThatThrownBy(() -> new SessionSettings.Video(0, 720, 1500, 30, VideoCodec.H264, 2, VideoRotation.AUTO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Resolution");
        assertThatThrownBy(() -> new SessionSettings.Video(1280, 720, 0, 30, VideoCodec.H264, 2, VideoRotation.AUTO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bitrate");
    }

    @Test
    void rejectsInvalidAudio() {
        assertThatThrownBy(() -> new SessionSettings.Audio(0, true, 128, false, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Sample rate");
    }
}
