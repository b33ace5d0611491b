package com.phillippitts.streamwatch.service.session.ffmpeg;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FfmpegProgressParserTest {

    @Test
    void emitsOneBlockPerProgressMarker() {
        FfmpegProgressParser parser = new FfmpegProgressParser();
        List<FfmpegProgressParser.Block> blocks = new ArrayList<>();
        String output = """
                frame=30
                fps=29.97
                bitrate=2483.7kbits/s
                total_size=1048576
                out_time_ms=1000000
                speed=1.00x
                progress=continue
                frame=60
                bitrate=N/A
                progress=continue
                frame=61
                bitrate=1200.0kbits/s
                progress=end
                """;

        output.lines().forEach(line -> parser.accept(line).ifPresent(blocks::add));

        assertThat(blocks).containsExactly(
                new FfmpegProgressParser.Block(2_483_700, false),
                new FfmpegProgressParser.Block(0, false),
                new FfmpegProgressParser.Block(1_200_000, true));
    }

    @Test
    void blockWithoutBitrateReportsZero() {
        FfmpegProgressParser parser = new FfmpegProgressParser();
        parser.accept("bitrate=900kbits/s");
        parser.accept("progress=continue");

        assertThat(parser.accept("progress=continue")).contains(new FfmpegProgressParser.Block(0, false));
    }

    @Test
    void ignoresNoise() {
        FfmpegProgressParser parser = new FfmpegProgressParser();

        assertThat(parser.accept(null)).isEmpty();
        assertThat(parser.accept("")).isEmpty();
        assertThat(parser.accept("=value")).isEmpty();
        assertThat(parser.accept("[flv @ 0x55] Failed to update header")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "2483.7kbits/s, 2483700",
            "1.5mbits/s, 1500000",
            "640bits/s, 640",
            "N/A, 0",
            "-1.0kbits/s, 0",
            "abckbits/s, 0",
            "12345, 0"
    })
    void parsesBitrateUnits(String value, long expected) {
        assertThat(FfmpegProgressParser.parseBitrate(value)).isEqualTo(expected);
    }
}
