package com.lingshield.core.analysis;

import com.lingshield.api.security.Severity;
import com.lingshield.core.analysis.bytecode.BytecodeParser;
import com.lingshield.core.analysis.bytecode.ParsedClass;
import com.lingshield.core.analysis.bytecode.StructuralScanner;
import com.lingshield.core.analysis.bytecode.TaintAnalyzer;
import com.lingshield.core.analysis.source.ConfigurationScanner;
import com.lingshield.core.analysis.source.PatternScanner;
import com.lingshield.core.analysis.source.SourceCollector;
import com.lingshield.core.analysis.source.SourceFile;
import com.lingshield.core.exception.AnalysisTimeoutException;
import com.lingshield.core.util.ContentHasher;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 插件静态代码分析器
 * <p>
 * 四个相互独立的检测阶段：
 * <ol>
 *     <li>正则模式扫描（源码）与配置项检查</li>
 *     <li>字节码语法树结构规则</li>
 *     <li>方法内数据流：外部输入 → 敏感汇点</li>
 *     <li>跨方法污点传播</li>
 * </ol>
 * 结果去重（文件 + 行 + 类型）后按严重级别排序。任何异常都不会抛出到调用方。
 */
@Slf4j
public class CodeAnalyzer {

    private static final int COMPLEXITY_LIMIT = 100;
    private static final int NESTING_LIMIT = 5;

    private final AnalysisOptions defaultOptions;
    private final SourceCollector collector = new SourceCollector();
    private final PatternScanner patternScanner = new PatternScanner();
    private final ConfigurationScanner configurationScanner = new ConfigurationScanner();
    private final StructuralScanner structuralScanner = new StructuralScanner();
    private final TaintAnalyzer taintAnalyzer;
    private final ComplexityCalculator complexityCalculator = new ComplexityCalculator();
    private final RecommendationEngine recommendationEngine = new RecommendationEngine();

    public CodeAnalyzer() {
        this(AnalysisOptions.defaults(), new TaintAnalyzer());
    }

    public CodeAnalyzer(AnalysisOptions defaultOptions) {
        this(defaultOptions, new TaintAnalyzer());
    }

    public CodeAnalyzer(AnalysisOptions defaultOptions, TaintAnalyzer taintAnalyzer) {
        this.defaultOptions = defaultOptions;
        this.taintAnalyzer = taintAnalyzer;
    }

    public CodeAnalysisResult analyze(Path rootPath) {
        return analyze(rootPath, defaultOptions);
    }

    public CodeAnalysisResult analyze(Path rootPath, AnalysisOptions options) {
        long start = System.currentTimeMillis();
        String name = rootPath == null || rootPath.getFileName() == null ? String.valueOf(rootPath)
                : rootPath.getFileName().toString();
        try {
            if (rootPath == null || !Files.exists(rootPath)) {
                log.warn("[{}] Analysis root does not exist", name);
                return CodeAnalysisResult.failed(AnalysisStatus.FAILED, "Path not found: " + rootPath, elapsed(start));
            }
            Deadline deadline = Deadline.after(options.getTimeoutMs());
            log.info("[{}] Starting static analysis", name);

            SourceCollector.Collected collected = collector.collect(rootPath, options, deadline);
            List<SourceFile> files = collected.files();
            BytecodeParser parser = new BytecodeParser();
            List<ParsedClass> classes = new ArrayList<>();
            List<SecurityVulnerability> findings = new ArrayList<>();

            for (SourceFile file : files) {
                deadline.check();
                try {
                    switch (file.kind()) {
                        case SOURCE:
                            findings.addAll(patternScanner.scan(file, deadline));
                            break;
                        case CONFIG:
                            findings.addAll(configurationScanner.scan(file));
                            break;
                        default:
                            classes.addAll(parser.parse(file, deadline));
                            break;
                    }
                } catch (AnalysisTimeoutException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("[{}] Failed to analyze {}: {}", name, file.relativePath(), e.toString());
                }
            }

            for (ParsedClass parsed : classes) {
                try {
                    findings.addAll(structuralScanner.scan(parsed, deadline));
                } catch (AnalysisTimeoutException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("[{}] Structural scan failed for {}: {}", name, parsed.relativePath(), e.toString());
                }
            }

            TaintAnalyzer.Report taint = taintAnalyzer.analyze(classes, deadline);
            findings.addAll(taint.dataFlow());
            findings.addAll(taint.propagation());

            List<SecurityVulnerability> ranked = deduplicateAndRank(findings);
            QualityMetrics metrics = complexityCalculator.calculate(files, classes);
            int score = score(ranked, metrics);
            boolean safe = ranked.stream().noneMatch(v -> v.getSeverity().isBlocking());

            CodeAnalysisResult result = CodeAnalysisResult.builder()
                    .status(AnalysisStatus.COMPLETED)
                    .safe(safe)
                    .score(score)
                    .vulnerabilities(ranked)
                    .qualityMetrics(metrics)
                    .recommendations(recommendationEngine.recommend(ranked, metrics))
                    .signature(ContentHasher.hashEntries(files.stream()
                            .map(f -> new ContentHasher.Entry(f.relativePath(), f.content()))
                            .collect(Collectors.toList())))
                    .filesAnalyzed(files.size())
                    .filesSkipped(collected.skipped() + parser.getFailures())
                    .durationMs(elapsed(start))
                    .build();
            log.info("[{}] Static analysis completed: score={}, findings={}, safe={}",
                    name, score, ranked.size(), safe);
            return result;
        } catch (AnalysisTimeoutException e) {
            log.warn("[{}] Static analysis timed out after {}ms", name, e.getTimeoutMs());
            return CodeAnalysisResult.failed(AnalysisStatus.TIMEOUT, e.getMessage(), elapsed(start));
        } catch (Exception e) {
            log.error("[{}] Static analysis failed", name, e);
            return CodeAnalysisResult.failed(AnalysisStatus.FAILED, e.toString(), elapsed(start));
        }
    }

    /**
     * 100 − 各级扣分 − 复杂度惩罚，下限 0
     */
    public static int score(List<SecurityVulnerability> findings, QualityMetrics metrics) {
        int score = 100;
        for (SecurityVulnerability finding : findings) {
            score -= deduction(finding.getSeverity());
        }
        if (metrics.getCyclomaticComplexity() > COMPLEXITY_LIMIT) {
            score -= 10;
        }
        if (metrics.getMaxNestingDepth() > NESTING_LIMIT) {
            score -= 5;
        }
        return Math.max(0, score);
    }

    static int deduction(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return 25;
            case HIGH:
                return 15;
            case MEDIUM:
                return 8;
            case LOW:
                return 3;
            default:
                return 0;
        }
    }

    static List<SecurityVulnerability> deduplicateAndRank(List<SecurityVulnerability> findings) {
        Map<String, SecurityVulnerability> unique = new LinkedHashMap<>();
        for (SecurityVulnerability finding : findings) {
            unique.merge(finding.dedupKey(), finding, CodeAnalyzer::preferred);
        }
        List<SecurityVulnerability> ranked = new ArrayList<>(unique.values());
        ranked.sort(Comparator.comparing((SecurityVulnerability v) -> v.getSeverity().getLevel()).reversed()
                .thenComparing(v -> v.getLocation().file())
                .thenComparingInt(v -> v.getLocation().line()));
        return ranked;
    }

    // 同位置同类型：保留级别更高者，级别相同时保留更深阶段的发现
    private static SecurityVulnerability preferred(SecurityVulnerability kept, SecurityVulnerability fresh) {
        int bySeverity = Integer.compare(fresh.getSeverity().getLevel(), kept.getSeverity().getLevel());
        if (bySeverity != 0) {
            return bySeverity > 0 ? fresh : kept;
        }
        return fresh.getPass().ordinal() > kept.getPass().ordinal() ? fresh : kept;
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
