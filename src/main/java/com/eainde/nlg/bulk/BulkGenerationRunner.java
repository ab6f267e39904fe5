package com.eainde.nlg.bulk;

import com.eainde.nlg.config.NlgProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs bulk generation at startup when the application is started with {@code --bulk}.
 * {@code --datasets=a,b} and {@code --languages=x,y} narrow the run.
 */
@Log4j2
@Component
public class BulkGenerationRunner implements ApplicationRunner {

    private final BulkArticleGenerator generator;
    private final NlgProperties properties;

    public BulkGenerationRunner(BulkArticleGenerator generator, NlgProperties properties) {
        this.generator = generator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("bulk")) {
            return;
        }
        Path out = Path.of(properties.getBulk().getOutputDirectory());
        log.info("Bulk generating articles into {}", out.toAbsolutePath());
        BulkArticleGenerator.Report report = generator.generate(out, listOption(args, "datasets"),
                listOption(args, "languages"));
        if (!report.failed().isEmpty()) {
            log.warn("Failed articles: {}", report.failed());
        }
    }

    private static List<String> listOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(value -> List.of(value.split(",")).stream())
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .toList();
    }
}
