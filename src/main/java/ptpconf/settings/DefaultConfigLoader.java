package ptpconf.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class DefaultConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(DefaultConfigLoader.class);

    public String load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigLoadException(path.getFileName() + " file doesn't exist");
        }
        try {
            String data = Files.readString(path, StandardCharsets.UTF_8);
            log.info("Loaded default configuration {}", path);
            return data;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
