package com.lingshield.core.analysis.bytecode;

import com.lingshield.core.analysis.VulnerabilityType;
import org.objectweb.asm.tree.MethodInsnNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 污点源、汇点与净化函数的声明
 */
public final class TaintSpecification {

    /**
     * 敏感汇点类别
     */
    public enum SinkCategory {
        COMMAND_EXECUTION(VulnerabilityType.COMMAND_INJECTION, "command execution"),
        QUERY_CONSTRUCTION(VulnerabilityType.SQL_INJECTION, "query construction"),
        FILE_WRITE(VulnerabilityType.PATH_TRAVERSAL, "file write"),
        CODE_EVALUATION(VulnerabilityType.CODE_INJECTION, "code evaluation");

        private final VulnerabilityType type;
        private final String label;

        SinkCategory(VulnerabilityType type, String label) {
            this.type = type;
            this.label = label;
        }

        public VulnerabilityType getType() {
            return type;
        }

        public String getLabel() {
            return label;
        }
    }

    private record MethodRef(String owner, String name) {
    }

    private static final String ANY = "*";

    private static final Pattern SANITIZER_NAME =
            Pattern.compile("(?i)^(sanitize|escape|encode|validate|clean|quote|whitelist|allowlist).*");

    private final Map<MethodRef, String> sources = new HashMap<>();
    private final Map<MethodRef, SinkCategory> sinks = new HashMap<>();
    private final Set<MethodRef> sanitizers = new HashSet<>();

    private TaintSpecification() {
    }

    public static TaintSpecification empty() {
        return new TaintSpecification();
    }

    /**
     * 内置规则：Servlet 请求、环境变量、控制台与网络输入 → 进程、SQL、文件写入
     */
    public static TaintSpecification defaults() {
        TaintSpecification spec = new TaintSpecification();
        for (String request : new String[]{"javax/servlet/ServletRequest", "javax/servlet/http/HttpServletRequest",
                "jakarta/servlet/ServletRequest", "jakarta/servlet/http/HttpServletRequest"}) {
            for (String name : new String[]{"getParameter", "getParameterValues", "getParameterMap", "getHeader",
                    "getQueryString", "getCookies", "getInputStream", "getReader", "getRequestURI"}) {
                spec.source(request, name);
            }
        }
        spec.source("java/lang/System", "getenv")
                .source("java/io/BufferedReader", "readLine")
                .source("java/io/Console", "readLine")
                .source("java/util/Scanner", "next")
                .source("java/util/Scanner", "nextLine")
                .source("java/net/URLConnection", "getInputStream")
                .source("java/net/HttpURLConnection", "getInputStream")
                .source("java/net/Socket", "getInputStream")
                .source("java/net/http/HttpResponse", "body");

        spec.sink("java/lang/Runtime", "exec", SinkCategory.COMMAND_EXECUTION)
                .sink("java/lang/ProcessBuilder", "<init>", SinkCategory.COMMAND_EXECUTION)
                .sink("java/lang/ProcessBuilder", "command", SinkCategory.COMMAND_EXECUTION)
                .sink("javax/script/ScriptEngine", "eval", SinkCategory.CODE_EVALUATION);
        for (String statement : new String[]{"java/sql/Statement", "java/sql/PreparedStatement",
                "java/sql/CallableStatement"}) {
            for (String name : new String[]{"execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "addBatch"}) {
                spec.sink(statement, name, SinkCategory.QUERY_CONSTRUCTION);
            }
        }
        spec.sink("java/sql/Connection", "prepareStatement", SinkCategory.QUERY_CONSTRUCTION)
                .sink("java/sql/Connection", "prepareCall", SinkCategory.QUERY_CONSTRUCTION)
                .sink("java/io/FileOutputStream", "<init>", SinkCategory.FILE_WRITE)
                .sink("java/io/FileWriter", "<init>", SinkCategory.FILE_WRITE)
                .sink("java/io/RandomAccessFile", "<init>", SinkCategory.FILE_WRITE)
                .sink("java/nio/file/Files", "write", SinkCategory.FILE_WRITE)
                .sink("java/nio/file/Files", "writeString", SinkCategory.FILE_WRITE)
                .sink("java/nio/file/Files", "newOutputStream", SinkCategory.FILE_WRITE)
                .sink("java/nio/file/Files", "newBufferedWriter", SinkCategory.FILE_WRITE);

        spec.sanitizer("java/net/URLEncoder", ANY)
                .sanitizer("java/util/regex/Pattern", "quote")
                .sanitizer("java/lang/Integer", "parseInt")
                .sanitizer("java/lang/Integer", "valueOf")
                .sanitizer("java/lang/Long", "parseLong")
                .sanitizer("java/lang/Long", "valueOf")
                .sanitizer("java/lang/Boolean", "parseBoolean")
                .sanitizer("java/util/UUID", "fromString");
        return spec;
    }

    public TaintSpecification source(String owner, String name) {
        sources.put(new MethodRef(owner, name), owner.substring(owner.lastIndexOf('/') + 1) + "." + name);
        return this;
    }

    public TaintSpecification sink(String owner, String name, SinkCategory category) {
        sinks.put(new MethodRef(owner, name), category);
        return this;
    }

    public TaintSpecification sanitizer(String owner, String name) {
        sanitizers.add(new MethodRef(owner, name));
        return this;
    }

    public Optional<String> sourceLabel(MethodInsnNode call) {
        return Optional.ofNullable(sources.get(new MethodRef(call.owner, call.name)));
    }

    public Optional<SinkCategory> sink(MethodInsnNode call) {
        return Optional.ofNullable(sinks.get(new MethodRef(call.owner, call.name)));
    }

    public boolean isSanitizer(MethodInsnNode call) {
        return sanitizers.contains(new MethodRef(call.owner, call.name))
                || sanitizers.contains(new MethodRef(call.owner, ANY))
                || SANITIZER_NAME.matcher(call.name).matches();
    }
}
