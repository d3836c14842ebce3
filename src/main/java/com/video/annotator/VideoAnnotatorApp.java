package com.video.annotator;

import com.video.annotator.config.AnnotatorConfig;
import com.video.annotator.exception.AnnotatorException;
import com.video.annotator.exception.StreamUnavailableException;
import com.video.annotator.export.ExportNames;
import com.video.annotator.model.RenderRequest;
import com.video.annotator.model.VideoSession;
import com.video.annotator.processor.CompositionPipeline;
import com.video.annotator.serialization.AnnotatorJson;
import com.video.annotator.service.FrameAnnotatorService;
import com.video.annotator.store.ImportSummary;
import com.video.annotator.video.ExactFrameLocator;
import com.video.annotator.video.FFmpegVideoDecoder;
import com.video.annotator.video.MediaInfoReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行入口
 * 命令：
 * 1. capture &lt;video&gt; &lt;seconds&gt; &lt;out.png&gt;  精确捕获 t 秒处的帧
 * 2. render &lt;frame.png&gt; &lt;request.json&gt; &lt;out.png&gt;  按滤镜/标注/放大倍数合成
 * 3. info &lt;video&gt;  输出视频元数据报告
 * 4. export &lt;video&gt; &lt;gallery.json&gt; &lt;outDir&gt;  按图库重新捕获并导出 ZIP/CSV/图库/分类
 */
public class VideoAnnotatorApp {

    private static final Logger LOG = LoggerFactory.getLogger(VideoAnnotatorApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  capture <video> <seconds> <out.png>",
            "  render <frame.png> <request.json> <out.png>",
            "  info <video>",
            "  export <video> <gallery.json> <outDir>");

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        try {
            switch (args[0]) {
                case "capture":
                    if (args.length != 4) {
                        break;
                    }
                    double seconds;
                    try {
                        seconds = Double.parseDouble(args[2]);
                    } catch (NumberFormatException e) {
                        err.println("Invalid timestamp: " + args[2]);
                        return EXIT_USAGE;
                    }
                    capture(Paths.get(args[1]), seconds, Paths.get(args[3]));
                    out.println("Frame written to " + args[3]);
                    return EXIT_OK;
                case "render":
                    if (args.length != 4) {
                        break;
                    }
                    render(Paths.get(args[1]), Paths.get(args[2]), Paths.get(args[3]));
                    out.println("Rendered image written to " + args[3]);
                    return EXIT_OK;
                case "info":
                    if (args.length != 2) {
                        break;
                    }
                    out.print(new MediaInfoReporter().describe(Paths.get(args[1])));
                    return EXIT_OK;
                case "export":
                    if (args.length != 4) {
                        break;
                    }
                    out.println(export(Paths.get(args[1]), Paths.get(args[2]), Paths.get(args[3])));
                    return EXIT_OK;
                default:
                    break;
            }
        } catch (AnnotatorException e) {
            LOG.error("Command '{}' failed", args[0], e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Command '{}' failed", args[0], e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static void capture(Path video, double seconds, Path outPath) {
        AnnotatorConfig config = AnnotatorConfig.loadConfig();
        new ExactFrameLocator(FFmpegVideoDecoder::new, config).extractTo(video, seconds, outPath);
    }

    private static String export(Path video, Path gallery, Path outDir) throws IOException {
        if (!Files.isRegularFile(video)) {
            throw new StreamUnavailableException("Video file not found: " + video);
        }
        FrameAnnotatorService service = FrameAnnotatorService.create(AnnotatorConfig.loadConfig());
        VideoSession session = service.registerVideo(video, video.getFileName().toString());

        ImportSummary summary;
        try (InputStream input = Files.newInputStream(gallery)) {
            summary = service.importGallery(session.getId(), input);
        }

        Files.createDirectories(outDir);
        int archived;
        try (OutputStream zip = Files.newOutputStream(outDir.resolve(ExportNames.zipFile(session)))) {
            archived = service.exportZip(session.getId(), zip);
        }
        Files.write(outDir.resolve(ExportNames.csvFile(session)), service.exportCsv(session.getId()));
        Files.write(outDir.resolve(ExportNames.galleryFile(session)), service.exportGallery(session.getId()));
        Files.write(outDir.resolve(ExportNames.categoriesFile(session)), service.exportCategories());
        return String.format("Imported %d frames (%d skipped), archived %d into %s",
                summary.getImported(), summary.getSkipped(), archived, outDir);
    }

    private static void render(Path frame, Path requestFile, Path outPath) throws IOException {
        RenderRequest request = AnnotatorJson.readRenderRequest(Files.readAllBytes(requestFile));
        request.setImageBytes(Files.readAllBytes(frame));
        byte[] png = new CompositionPipeline().compose(request);
        Path parent = outPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(outPath, png);
    }
}
