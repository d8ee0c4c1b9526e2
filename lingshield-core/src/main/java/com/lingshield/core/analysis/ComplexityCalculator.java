package com.lingshield.core.analysis;

import com.lingshield.core.analysis.bytecode.ParsedClass;
import com.lingshield.core.analysis.source.FileKind;
import com.lingshield.core.analysis.source.SourceFile;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 质量指标计算
 * <p>
 * 圈复杂度优先取自字节码（分支指令 + switch 分支数），无类文件时按源码关键字估算；
 * 嵌套深度取自源码花括号，扣除类体与方法体两层（脚本类源码扣除一层）。
 */
public class ComplexityCalculator {

    private static final Pattern DECISION = Pattern.compile("\\b(if|for|while|case|catch)\\b|&&|\\|\\||\\?");
    private static final Set<String> JVM_SOURCES = Set.of("java", "kt", "groovy");

    public QualityMetrics calculate(List<SourceFile> files, List<ParsedClass> classes) {
        int loc = 0;
        int comments = 0;
        int maxNesting = 0;
        int sourceDecisions = 0;
        int sourceFiles = 0;

        for (SourceFile file : files) {
            if (file.kind() != FileKind.SOURCE) {
                continue;
            }
            sourceFiles++;
            int depth = 0;
            int fileMax = 0;
            boolean inBlock = false;
            for (String raw : file.lines()) {
                String line = raw.trim();
                if (line.isEmpty()) {
                    continue;
                }
                if (inBlock || line.startsWith("/*") || line.startsWith("//") || line.startsWith("*")) {
                    comments++;
                    if (line.startsWith("/*")) {
                        inBlock = !line.contains("*/");
                    } else if (inBlock && line.contains("*/")) {
                        inBlock = false;
                    }
                    continue;
                }
                loc++;
                String code = stripStrings(line);
                Matcher decisions = DECISION.matcher(code);
                while (decisions.find()) {
                    sourceDecisions++;
                }
                for (int i = 0; i < code.length(); i++) {
                    char c = code.charAt(i);
                    if (c == '{') {
                        depth++;
                        fileMax = Math.max(fileMax, depth);
                    } else if (c == '}') {
                        depth = Math.max(0, depth - 1);
                    }
                }
            }
            int baseline = JVM_SOURCES.contains(file.extension()) ? 2 : 1;
            maxNesting = Math.max(maxNesting, Math.max(0, fileMax - baseline));
        }

        int methods = 0;
        int totalComplexity = 0;
        int maxMethod = 0;
        for (ParsedClass parsed : classes) {
            for (MethodNode method : parsed.node().methods) {
                if ((method.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) {
                    continue;
                }
                methods++;
                int complexity = methodComplexity(method);
                totalComplexity += complexity;
                maxMethod = Math.max(maxMethod, complexity);
            }
        }
        if (classes.isEmpty()) {
            totalComplexity = sourceFiles + sourceDecisions;
            maxMethod = totalComplexity;
        }

        return QualityMetrics.builder()
                .files(files.size())
                .linesOfCode(loc)
                .commentLines(comments)
                .classes(classes.size())
                .methods(methods)
                .cyclomaticComplexity(totalComplexity)
                .maxMethodComplexity(maxMethod)
                .maxNestingDepth(maxNesting)
                .build();
    }

    static int methodComplexity(MethodNode method) {
        int complexity = 1;
        for (AbstractInsnNode insn : method.instructions) {
            if (insn instanceof JumpInsnNode) {
                int opcode = insn.getOpcode();
                if (opcode != Opcodes.GOTO && opcode != Opcodes.JSR) {
                    complexity++;
                }
            } else if (insn instanceof TableSwitchInsnNode) {
                complexity += ((TableSwitchInsnNode) insn).labels.size();
            } else if (insn instanceof LookupSwitchInsnNode) {
                complexity += ((LookupSwitchInsnNode) insn).labels.size();
            }
        }
        return complexity;
    }

    private static String stripStrings(String line) {
        return line.replaceAll("\"(\\\\.|[^\"\\\\])*\"", "\"\"").replaceAll("'(\\\\.|[^'\\\\])*'", "''");
    }
}
