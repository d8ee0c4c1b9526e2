package com.lingshield.core.analysis.bytecode;

import com.lingshield.api.security.Severity;
import com.lingshield.core.analysis.AnalysisPass;
import com.lingshield.core.analysis.Deadline;
import com.lingshield.core.analysis.SecurityVulnerability;
import com.lingshield.core.analysis.SourceLocation;
import com.lingshield.core.analysis.bytecode.TaintSpecification.SinkCategory;
import lombok.extern.slf4j.Slf4j;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 第三、四阶段：数据流与污点传播
 * <p>
 * 第三阶段在方法内跟踪外部输入到敏感汇点的流动；第四阶段基于方法摘要迭代到不动点，
 * 发现跨方法的传播路径（A 读取输入 → B 传递 → C 执行命令）。
 */
@Slf4j
public class TaintAnalyzer {

    private static final int MAX_ITERATIONS = 10;

    private final TaintSpecification spec;

    public TaintAnalyzer() {
        this(TaintSpecification.defaults());
    }

    public TaintAnalyzer(TaintSpecification spec) {
        this.spec = spec;
    }

    /**
     * 分析结果
     */
    public record Report(List<SecurityVulnerability> dataFlow, List<SecurityVulnerability> propagation) {
    }

    private record MethodRef(ParsedClass owner, MethodNode method, String key) {
    }

    private record MethodResult(List<TaintInterpreter.SinkHit> hits, Set<String> returnOrigins) {
    }

    public Report analyze(List<ParsedClass> classes, Deadline deadline) {
        List<MethodRef> methods = new ArrayList<>();
        Map<String, MethodSummary> summaries = new HashMap<>();
        for (ParsedClass parsed : classes) {
            for (MethodNode method : parsed.node().methods) {
                String key = MethodSummary.key(parsed.node().name, method.name, method.desc);
                summaries.put(key, MethodSummary.EMPTY);
                if (method.instructions.size() > 0) {
                    methods.add(new MethodRef(parsed, method, key));
                }
            }
        }

        Map<MethodRef, MethodResult> results = new LinkedHashMap<>();
        for (int iteration = 1; iteration <= MAX_ITERATIONS; iteration++) {
            boolean changed = false;
            for (MethodRef ref : methods) {
                deadline.check();
                MethodResult result = analyzeMethod(ref, summaries);
                if (result == null) {
                    continue;
                }
                results.put(ref, result);
                MethodSummary summary = summarize(result);
                if (!summary.equals(summaries.get(ref.key()))) {
                    summaries.put(ref.key(), summary);
                    changed = true;
                }
            }
            if (!changed) {
                log.debug("Taint summaries converged after {} iteration(s)", iteration);
                break;
            }
        }

        List<SecurityVulnerability> dataFlow = new ArrayList<>();
        List<SecurityVulnerability> propagation = new ArrayList<>();
        for (Map.Entry<MethodRef, MethodResult> entry : results.entrySet()) {
            for (TaintInterpreter.SinkHit hit : entry.getValue().hits()) {
                report(entry.getKey(), hit, dataFlow, propagation);
            }
        }
        return new Report(dataFlow, propagation);
    }

    private MethodResult analyzeMethod(MethodRef ref, Map<String, MethodSummary> summaries) {
        TaintInterpreter interpreter = new TaintInterpreter(ref.method(), spec, summaries);
        try {
            new Analyzer<>(interpreter).analyze(ref.owner().node().name, ref.method());
        } catch (AnalyzerException e) {
            log.warn("Skipping data-flow analysis of {}: {}", ref.owner().member(ref.method()), e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Skipping malformed method {}: {}", ref.owner().member(ref.method()), e.toString());
            return null;
        }
        return new MethodResult(interpreter.hits(), interpreter.returnOrigins());
    }

    private static MethodSummary summarize(MethodResult result) {
        boolean returnsTaint = result.returnOrigins().stream().anyMatch(TaintAnalyzer::isExternal);
        Set<Integer> passthrough = paramsOf(result.returnOrigins());
        Map<Integer, SinkCategory> sinkParams = new HashMap<>();
        for (TaintInterpreter.SinkHit hit : result.hits()) {
            for (Integer param : paramsOf(hit.origins())) {
                sinkParams.putIfAbsent(param, hit.category());
            }
        }
        return new MethodSummary(returnsTaint, passthrough, sinkParams);
    }

    private void report(MethodRef ref, TaintInterpreter.SinkHit hit,
                        List<SecurityVulnerability> dataFlow, List<SecurityVulnerability> propagation) {
        Set<String> external = hit.origins().stream()
                .filter(TaintAnalyzer::isExternal)
                .collect(Collectors.toCollection(TreeSet::new));
        if (external.isEmpty()) {
            return;
        }
        boolean crossMethod = hit.via() != null
                || external.stream().anyMatch(o -> o.startsWith(TaintValue.CALL_PREFIX));
        String from = external.stream().map(TaintAnalyzer::describeOrigin).collect(Collectors.joining(", "));
        SourceLocation location = new SourceLocation(ref.owner().relativePath(),
                ParsedClass.lineOf(hit.insn()), ref.owner().member(ref.method()));

        if (crossMethod) {
            propagation.add(SecurityVulnerability.builder()
                    .type(hit.category().getType())
                    .severity(Severity.CRITICAL)
                    .title("Tainted data reaches " + hit.category().getLabel())
                    .description("Untrusted data from " + from + " propagates across methods into " + hit.sink())
                    .location(location)
                    .evidence(hit.sink())
                    .remediation("Validate or sanitize the value before it leaves the method that reads it")
                    .pass(AnalysisPass.TAINT_PROPAGATION)
                    .build());
        } else {
            dataFlow.add(SecurityVulnerability.builder()
                    .type(hit.category().getType())
                    .severity(Severity.HIGH)
                    .title("Untrusted input flows into " + hit.category().getLabel())
                    .description("Data from " + from + " reaches " + hit.sink() + " without sanitization")
                    .location(location)
                    .evidence(hit.sink())
                    .remediation("Sanitize or validate the input before using it in " + hit.category().getLabel())
                    .pass(AnalysisPass.DATA_FLOW)
                    .build());
        }
    }

    private static boolean isExternal(String origin) {
        return origin.startsWith(TaintValue.SOURCE_PREFIX) || origin.startsWith(TaintValue.CALL_PREFIX);
    }

    private static Set<Integer> paramsOf(Set<String> origins) {
        Set<Integer> params = new HashSet<>();
        for (String origin : origins) {
            if (origin.startsWith(TaintValue.PARAM_PREFIX)) {
                params.add(Integer.parseInt(origin.substring(TaintValue.PARAM_PREFIX.length())));
            }
        }
        return params;
    }

    private static String describeOrigin(String origin) {
        if (origin.startsWith(TaintValue.SOURCE_PREFIX)) {
            return origin.substring(TaintValue.SOURCE_PREFIX.length());
        }
        return MethodSummary.displayName(origin.substring(TaintValue.CALL_PREFIX.length()));
    }
}
