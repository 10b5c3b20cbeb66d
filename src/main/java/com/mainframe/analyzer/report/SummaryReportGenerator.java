package com.mainframe.analyzer.report;

import com.mainframe.analyzer.pipeline.BatchAnalysis;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the Markdown summary of a batch from {@code templates/analysis-summary.ftl}.
 */
public class SummaryReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(SummaryReportGenerator.class);

    static final String TEMPLATE = "analysis-summary.ftl";

    private final Configuration freemarkerConfig;

    public SummaryReportGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocale(Locale.ROOT);
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(BatchAnalysis batch) {
        Map<String, Object> model = new HashMap<>();
        model.put("batch", batch);
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportGenerationException("Could not render " + TEMPLATE, e);
        }
    }

    public Path write(BatchAnalysis batch, Path target) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, render(batch));
        } catch (IOException e) {
            throw new ReportGenerationException("Could not write " + target, e);
        }
        log.info("Wrote summary {}", target.toAbsolutePath());
        return target;
    }
}
