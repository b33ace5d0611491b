package com.phillippitts.streamwatch.service.session.ffmpeg;

import com.phillippitts.streamwatch.config.properties.FfmpegProperties;
import com.phillippitts.streamwatch.domain.CameraFacing;
import com.phillippitts.streamwatch.domain.VideoCodec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a deterministic ffmpeg command line for one capture-encode-publish run.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -hide_banner -nostats -loglevel warning -progress pipe:1
 *   -f ${inputFormat} -framerate ${fps} -video_size ${w}x${h} -i ${device}
 *   [-f ${audioFormat} -i ${audioDevice}]
 *   [-vf transpose...] -c:v ${encoder} -preset ${preset} -tune zerolatency
 *   -b:v ${bps} -maxrate ${bps} -bufsize ${2*bps} -g ${gop} -pix_fmt yuv420p
 *   (-c:a aac -b:a ${bps} -ar ${rate} -ac ${channels} [-af ...] | -an)
 *   -f ${outputFormat} ${url}
 * </pre>
 */
final class FfmpegCommandBuilder {

    private final FfmpegProperties props;

    FfmpegCommandBuilder(FfmpegProperties props) {
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    List<String> build(String url,
                       EncoderParams.Video video,
                       EncoderParams.Audio audio,
                       VideoCodec codec,
                       CameraFacing facing,
                       boolean muted) {
        Objects.requireNonNull(url, "url must not be null");
        Objects.requireNonNull(video, "video must not be null");
        Objects.requireNonNull(codec, "codec must not be null");
        Objects.requireNonNull(facing, "facing must not be null");

        List<String> cmd = new ArrayList<>();
        cmd.add(resolveBinary(props.getBinaryPath()));
        cmd.add("-hide_banner");
        cmd.add("-nostats");
        cmd.add("-loglevel");
        cmd.add("warning");
        cmd.add("-progress");
        cmd.add("pipe:1");

        cmd.add("-f");
        cmd.add(props.getInputFormat());
        cmd.add("-framerate");
        cmd.add(String.valueOf(video.fps()));
        cmd.add("-video_size");
        cmd.add(video.width() + "x" + video.height());
        cmd.add("-i");
        cmd.add(facing == CameraFacing.BACK ? props.getBackDevice() : props.getFrontDevice());

        if (audio != null) {
            cmd.add("-f");
            cmd.add(props.getAudioFormat());
            cmd.add("-i");
            cmd.add(props.getAudioDevice());
        }

        String rotation = rotationFilter(video.rotationDeg());
        if (rotation != null) {
            cmd.add("-vf");
            cmd.add(rotation);
        }
        cmd.add("-c:v");
        cmd.add(codec.encoderName());
        cmd.add("-preset");
        cmd.add(props.getPreset());
        cmd.add("-tune");
        cmd.add("zerolatency");
        cmd.add("-b:v");
        cmd.add(String.valueOf(video.bitrateBps()));
        cmd.add("-maxrate");
        cmd.add(String.valueOf(video.bitrateBps()));
        cmd.add("-bufsize");
        cmd.add(String.valueOf(video.bitrateBps() * 2));
        cmd.add("-g");
        cmd.add(String.valueOf(video.gopSize()));
        cmd.add("-pix_fmt");
        cmd.add("yuv420p");

        if (audio != null) {
            cmd.add("-c:a");
            cmd.add("aac");
            cmd.add("-b:a");
            cmd.add(String.valueOf(audio.bitrateBps()));
            cmd.add("-ar");
            cmd.add(String.valueOf(audio.sampleRate()));
            cmd.add("-ac");
            cmd.add(audio.stereo() ? "2" : "1");
            String audioFilter = audioFilter(audio, muted);
            if (audioFilter != null) {
                cmd.add("-af");
                cmd.add(audioFilter);
            }
        } else {
            cmd.add("-an");
        }

        cmd.add("-f");
        cmd.add(props.getOutputFormat());
        cmd.add(url);
        return cmd;
    }

    static String rotationFilter(int degrees) {
        return switch (Math.floorMod(degrees, 360)) {
            case 90 -> "transpose=1";
            case 180 -> "transpose=1,transpose=1";
            case 270 -> "transpose=2";
            default -> null;
        };
    }

    private static String audioFilter(EncoderParams.Audio audio, boolean muted) {
        List<String> filters = new ArrayList<>();
        if (audio.noiseSuppress()) {
            filters.add("afftdn");
        }
        if (muted) {
            filters.add("volume=0");
        }
        return filters.isEmpty() ? null : String.join(",", filters);
    }

    private static String resolveBinary(String binary) {
        // Bare names are left for PATH lookup
        if (!binary.contains("/") && !binary.contains("\\")) {
            return binary;
        }
        Path path = Path.of(binary);
        return path.isAbsolute() ? path.toString()
                : Path.of(".").toAbsolutePath().normalize().resolve(path).normalize().toString();
    }
}
