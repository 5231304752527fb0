package org.iceforge.tilecut.archive;

import org.iceforge.tilecut.TilecutProperties;
import org.iceforge.tilecut.extract.WindowExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
public class ArchiveConfig {
    private static final Logger log = LoggerFactory.getLogger(ArchiveConfig.class);

    @Bean
    public FileNameResolver fileNameResolver(TilecutProperties props) {
        Path root = Path.of(props.getArchiveRoot());
        if (!Files.isDirectory(root)) {
            log.warn("Archive root {} does not exist yet; every lookup will come back empty", root.toAbsolutePath());
        }
        return new FileNameResolver(root);
    }

    @Bean
    public WindowExtractor windowExtractor() {
        return new WindowExtractor();
    }
}
