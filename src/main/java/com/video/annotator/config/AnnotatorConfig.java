package com.video.annotator.config;

import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 视频帧标注配置类
 */
@Data
public class AnnotatorConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnnotatorConfig.class);

    private static final String CONFIG_FILE = "application.properties";

    // 存储目录配置
    private String dataDir;
    private String framesDir;
    private String videosDir;
    private String categoriesFile;

    // 视频配置
    private double defaultFps;

    // 精确帧定位配置
    private long captureTimeoutMs;
    private long captureMaxDecodedFrames;

    // 导出配置
    private int exportParallelism;

    /**
     * 默认配置（不读取classpath）
     */
    public static AnnotatorConfig defaults() {
        return fromProperties(new Properties());
    }

    /**
     * 从配置文件加载配置，JVM系统属性可覆盖同名配置项
     */
    public static AnnotatorConfig loadConfig() {
        Properties props = new Properties();

        try (InputStream input = AnnotatorConfig.class.getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (input == null) {
                LOG.warn("Configuration file '{}' not found in classpath, using defaults", CONFIG_FILE);
            } else {
                props.load(input);
            }
        } catch (Exception e) {
            LOG.error("Error loading configuration", e);
            throw new RuntimeException("Failed to load configuration", e);
        }

        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("annotator.")) {
                props.setProperty(key, System.getProperty(key));
            }
        }

        AnnotatorConfig config = fromProperties(props);

        LOG.info("Configuration loaded successfully");
        LOG.info("Data dir: {}, frames: {}, videos: {}", config.getDataDir(), config.getFramesDir(), config.getVideosDir());
        LOG.info("Capture timeout: {}ms, max decoded frames: {}",
                config.getCaptureTimeoutMs(), config.getCaptureMaxDecodedFrames());
        return config;
    }

    static AnnotatorConfig fromProperties(Properties props) {
        AnnotatorConfig config = new AnnotatorConfig();

        String dataDir = props.getProperty("annotator.data.dir", "data");
        config.setDataDir(dataDir);
        config.setFramesDir(props.getProperty("annotator.frames.dir",
                Paths.get(dataDir, "frames").toString()));
        config.setVideosDir(props.getProperty("annotator.videos.dir",
                Paths.get(dataDir, "videos").toString()));
        config.setCategoriesFile(props.getProperty("annotator.categories.file",
                Paths.get(dataDir, "categories.json").toString()));

        config.setDefaultFps(Double.parseDouble(props.getProperty("annotator.default.fps", "30")));

        config.setCaptureTimeoutMs(Long.parseLong(
                props.getProperty("annotator.capture.timeout.ms", "30000")));
        config.setCaptureMaxDecodedFrames(Long.parseLong(
                props.getProperty("annotator.capture.max.decoded.frames", "100000")));

        config.setExportParallelism(Integer.parseInt(props.getProperty("annotator.export.parallelism",
                String.valueOf(Runtime.getRuntime().availableProcessors()))));
        return config;
    }

    /**
     * 以指定数据目录派生全部存储路径
     */
    public static AnnotatorConfig forDataDir(Path dataDir) {
        Properties props = new Properties();
        props.setProperty("annotator.data.dir", dataDir.toString());
        return fromProperties(props);
    }

    public Path framesPath() {
        return Paths.get(framesDir);
    }

    public Path videosPath() {
        return Paths.get(videosDir);
    }

    public Path categoriesPath() {
        return Paths.get(categoriesFile);
    }
}
