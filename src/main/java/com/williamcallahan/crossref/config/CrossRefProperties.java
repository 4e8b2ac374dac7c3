package com.williamcallahan.crossref.config;

import com.williamcallahan.crossref.domain.notes.NotePlacement;
import com.williamcallahan.crossref.domain.notes.NumberingStyle;
import com.williamcallahan.crossref.service.EngineOptions;
import com.williamcallahan.crossref.service.EngineOptions.AnchorOptions;
import com.williamcallahan.crossref.service.EngineOptions.IndexOptions;
import com.williamcallahan.crossref.service.EngineOptions.NotesOptions;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "crossref")
public class CrossRefProperties {

    private Anchors anchors = new Anchors();
    private Index index = new Index();
    private Notes notes = new Notes();
    private Engine engine = new Engine();
    private Cli cli = new Cli();

    public Anchors getAnchors() {
        return anchors;
    }

    public void setAnchors(Anchors anchors) {
        this.anchors = anchors;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    public Notes getNotes() {
        return notes;
    }

    public void setNotes(Notes notes) {
        this.notes = notes;
    }

    public Engine getEngine() {
        return engine;
    }

    public void setEngine(Engine engine) {
        this.engine = engine;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * Fails startup on values the engine would reject later.
     */
    @PostConstruct
    public void validateConfiguration() {
        toEngineOptions();
        if (cli.isEnabled() && (cli.getInputDir() == null || cli.getInputDir().isBlank())) {
            throw new IllegalArgumentException("crossref.cli.input-dir is required when the CLI is enabled");
        }
        if (cli.getOutputDir() == null || cli.getOutputDir().isBlank()) {
            throw new IllegalArgumentException("crossref.cli.output-dir cannot be blank");
        }
    }

    /**
     * Maps the bound properties into immutable engine options.
     *
     * @throws IllegalArgumentException when any value is out of range
     */
    public EngineOptions toEngineOptions() {
        AnchorOptions anchorOptions = new AnchorOptions(anchors.getIdPrefix(), anchors.getMaxIdLength(),
            anchors.getCollisionSuffixLength(), anchors.getMaxCollisionAttempts(), anchors.getFuzzyMinLength());
        IndexOptions indexOptions = new IndexOptions(index.isEnabled(), index.isCaseSensitive(),
            index.getIgnoreArticles(), index.getLocale(), index.getMaxEntriesPerLetter(), index.getMaxTocDepth(),
            index.isShowLetterHeaders(), index.isShowOccurrenceCount(), index.getFileName(), index.getTitle());
        NotesOptions notesOptions = new NotesOptions(notes.getPlacement(), notes.isGenerateBackRefs(),
            notes.getBackRefSymbol(), notes.getBackRefTitle(), notes.isRestartNumberingPerChapter(),
            notes.getFootnoteNumbering(), notes.getEndnoteNumbering(), notes.isRenumberCalls(),
            notes.getFileName(), notes.getTitle(), notes.isIncludeChapterHeadings());
        return new EngineOptions(anchorOptions, indexOptions, notesOptions, engine.getParallelism(),
            engine.getStylesheet());
    }

    public static class Anchors {
        private String idPrefix = "ref";
        private int maxIdLength = 50;
        private int collisionSuffixLength = 6;
        private int maxCollisionAttempts = 1000;
        private int fuzzyMinLength = 3;

        public String getIdPrefix() { return idPrefix; }
        public void setIdPrefix(String idPrefix) { this.idPrefix = idPrefix; }

        public int getMaxIdLength() { return maxIdLength; }
        public void setMaxIdLength(int maxIdLength) { this.maxIdLength = maxIdLength; }

        public int getCollisionSuffixLength() { return collisionSuffixLength; }
        public void setCollisionSuffixLength(int collisionSuffixLength) { this.collisionSuffixLength = collisionSuffixLength; }

        public int getMaxCollisionAttempts() { return maxCollisionAttempts; }
        public void setMaxCollisionAttempts(int maxCollisionAttempts) { this.maxCollisionAttempts = maxCollisionAttempts; }

        public int getFuzzyMinLength() { return fuzzyMinLength; }
        public void setFuzzyMinLength(int fuzzyMinLength) { this.fuzzyMinLength = fuzzyMinLength; }
    }

    public static class Index {
        private boolean enabled = true;
        private boolean caseSensitive = false;
        private List<String> ignoreArticles = new ArrayList<>(List.of("a", "an", "the"));
        private Locale locale = Locale.US;
        private int maxEntriesPerLetter = 1000;
        private int maxTocDepth = 6;
        private boolean showLetterHeaders = true;
        private boolean showOccurrenceCount = false;
        private String fileName = "index.xhtml";
        private String title = "Index";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isCaseSensitive() { return caseSensitive; }
        public void setCaseSensitive(boolean caseSensitive) { this.caseSensitive = caseSensitive; }

        public List<String> getIgnoreArticles() { return ignoreArticles; }
        public void setIgnoreArticles(List<String> ignoreArticles) { this.ignoreArticles = ignoreArticles; }

        public Locale getLocale() { return locale; }
        public void setLocale(Locale locale) { this.locale = locale; }

        public int getMaxEntriesPerLetter() { return maxEntriesPerLetter; }
        public void setMaxEntriesPerLetter(int maxEntriesPerLetter) { this.maxEntriesPerLetter = maxEntriesPerLetter; }

        public int getMaxTocDepth() { return maxTocDepth; }
        public void setMaxTocDepth(int maxTocDepth) { this.maxTocDepth = maxTocDepth; }

        public boolean isShowLetterHeaders() { return showLetterHeaders; }
        public void setShowLetterHeaders(boolean showLetterHeaders) { this.showLetterHeaders = showLetterHeaders; }

        public boolean isShowOccurrenceCount() { return showOccurrenceCount; }
        public void setShowOccurrenceCount(boolean showOccurrenceCount) { this.showOccurrenceCount = showOccurrenceCount; }

        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
    }

    public static class Notes {
        private NotePlacement placement = NotePlacement.INLINE;
        private boolean generateBackRefs = true;
        private String backRefSymbol = "↩";
        private String backRefTitle = "Return to text";
        private boolean restartNumberingPerChapter = true;
        private NumberingStyle footnoteNumbering = NumberingStyle.NUMERIC;
        private NumberingStyle endnoteNumbering = NumberingStyle.ROMAN;
        private boolean renumberCalls = false;
        private String fileName = "notes.xhtml";
        private String title = "Notes";
        private boolean includeChapterHeadings = true;

        public NotePlacement getPlacement() { return placement; }
        public void setPlacement(NotePlacement placement) { this.placement = placement; }

        public boolean isGenerateBackRefs() { return generateBackRefs; }
        public void setGenerateBackRefs(boolean generateBackRefs) { this.generateBackRefs = generateBackRefs; }

        public String getBackRefSymbol() { return backRefSymbol; }
        public void setBackRefSymbol(String backRefSymbol) { this.backRefSymbol = backRefSymbol; }

        public String getBackRefTitle() { return backRefTitle; }
        public void setBackRefTitle(String backRefTitle) { this.backRefTitle = backRefTitle; }

        public boolean isRestartNumberingPerChapter() { return restartNumberingPerChapter; }
        public void setRestartNumberingPerChapter(boolean restartNumberingPerChapter) { this.restartNumberingPerChapter = restartNumberingPerChapter; }

        public NumberingStyle getFootnoteNumbering() { return footnoteNumbering; }
        public void setFootnoteNumbering(NumberingStyle footnoteNumbering) { this.footnoteNumbering = footnoteNumbering; }

        public NumberingStyle getEndnoteNumbering() { return endnoteNumbering; }
        public void setEndnoteNumbering(NumberingStyle endnoteNumbering) { this.endnoteNumbering = endnoteNumbering; }

        public boolean isRenumberCalls() { return renumberCalls; }
        public void setRenumberCalls(boolean renumberCalls) { this.renumberCalls = renumberCalls; }

        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public boolean isIncludeChapterHeadings() { return includeChapterHeadings; }
        public void setIncludeChapterHeadings(boolean includeChapterHeadings) { this.includeChapterHeadings = includeChapterHeadings; }
    }

    public static class Engine {
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private String stylesheet = "styles.css";

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }

        public String getStylesheet() { return stylesheet; }
        public void setStylesheet(String stylesheet) { this.stylesheet = stylesheet; }
    }

    public static class Cli {
        private boolean enabled = false;
        private String inputDir = "data/chunks";
        private String outputDir = "data/crossref";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getInputDir() { return inputDir; }
        public void setInputDir(String inputDir) { this.inputDir = inputDir; }

        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    }
}
