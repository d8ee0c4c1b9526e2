package com.lingshield.core.analysis.bytecode;

import com.lingshield.api.security.Severity;
import com.lingshield.core.analysis.VulnerabilityType;
import org.objectweb.asm.Opcodes;

import java.util.Locale;
import java.util.Set;

/**
 * 结构规则注册表
 * <p>
 * 每条规则只检查一种 {@link NodeKind}，由 {@link StructuralScanner} 按节点种类分派。
 */
public enum StructuralRule {

    PROCESS_EXECUTION(NodeKind.METHOD_CALL, VulnerabilityType.COMMAND_INJECTION, Severity.HIGH,
            "Process execution", "Avoid spawning operating system processes from plugins") {
        @Override
        boolean matches(StructuralNode node) {
            return node.isCall("java/lang/Runtime", "exec") || node.isCall("java/lang/ProcessBuilder", "start");
        }
    },

    JVM_TERMINATION(NodeKind.METHOD_CALL, VulnerabilityType.DENIAL_OF_SERVICE, Severity.CRITICAL,
            "Host JVM termination", "Plugins must never terminate the host process") {
        @Override
        boolean matches(StructuralNode node) {
            return node.isCall("java/lang/System", "exit") || node.isCall("java/lang/Runtime", "exit", "halt");
        }
    },

    SCRIPT_EVALUATION(NodeKind.METHOD_CALL, VulnerabilityType.CODE_INJECTION, Severity.HIGH,
            "Script engine evaluation", "Restrict script evaluation to trusted static scripts") {
        @Override
        boolean matches(StructuralNode node) {
            return node.isCall("javax/script/ScriptEngine", "eval")
                    || node.isCall("javax/script/CompiledScript", "eval");
        }
    },

    NATIVE_DESERIALIZATION(NodeKind.METHOD_CALL, VulnerabilityType.UNSAFE_DESERIALIZATION, Severity.HIGH,
            "Java native deserialization", "Install an ObjectInputFilter or switch to a data-only format") {
        @Override
        boolean matches(StructuralNode node) {
            return node.isCall("java/io/ObjectInputStream", "readObject", "readUnshared")
                    || node.isCall("java/beans/XMLDecoder", "readObject");
        }
    },

    REFLECTIVE_ACCESS_OVERRIDE(NodeKind.METHOD_CALL, VulnerabilityType.PRIVILEGE_ESCALATION, Severity.MEDIUM,
            "Reflection access check override", "Do not bypass Java access control") {
        @Override
        boolean matches(StructuralNode node) {
            return "setAccessible".equals(node.call().name) && node.call().owner.startsWith("java/lang/reflect/");
        }
    },

    NATIVE_LIBRARY_LOAD(NodeKind.METHOD_CALL, VulnerabilityType.NATIVE_CODE, Severity.HIGH,
            "Native library loading", "Native code escapes every sandbox limit; remove it") {
        @Override
        boolean matches(StructuralNode node) {
            return node.isCall("java/lang/System", "load", "loadLibrary")
                    || node.isCall("java/lang/Runtime", "load", "loadLibrary");
        }
    },

    SECURITY_CONTROL_TAMPERING(NodeKind.METHOD_CALL, VulnerabilityType.PRIVILEGE_ESCALATION, Severity.HIGH,
            "Security control tampering", "Plugins must not replace JVM-wide security components") {
        @Override
        boolean matches(StructuralNode node) {
            return node.isCall("java/lang/System", "setSecurityManager")
                    || node.isCall("java/security/Security", "addProvider", "insertProviderAt", "setProperty")
                    || node.isCall("javax/net/ssl/HttpsURLConnection", "setDefaultHostnameVerifier",
                    "setDefaultSSLSocketFactory");
        }
    },

    UNSAFE_MEMORY_ACCESS(NodeKind.METHOD_CALL, VulnerabilityType.PRIVILEGE_ESCALATION, Severity.HIGH,
            "Unsafe memory access", "Remove sun.misc.Unsafe usage") {
        @Override
        boolean matches(StructuralNode node) {
            return UNSAFE_OWNERS.contains(node.call().owner);
        }
    },

    DYNAMIC_CLASS_DEFINITION(NodeKind.METHOD_CALL, VulnerabilityType.DYNAMIC_CODE_LOADING, Severity.MEDIUM,
            "Runtime class definition", "Ship all classes inside the signed plugin") {
        @Override
        boolean matches(StructuralNode node) {
            return "defineClass".equals(node.call().name)
                    && (node.call().owner.equals("java/lang/ClassLoader")
                    || node.call().owner.equals("java/lang/invoke/MethodHandles$Lookup")
                    || node.call().owner.equals("java/security/SecureClassLoader"));
        }
    },

    CLASS_LOADER_CREATION(NodeKind.TYPE_INSTANTIATION, VulnerabilityType.DYNAMIC_CODE_LOADING, Severity.MEDIUM,
            "Class loader creation", "Do not load code from outside the plugin package") {
        @Override
        boolean matches(StructuralNode node) {
            return node.insn().getOpcode() == Opcodes.NEW && CLASS_LOADERS.contains(node.type().desc);
        }
    },

    INSECURE_RANDOM(NodeKind.TYPE_INSTANTIATION, VulnerabilityType.INSECURE_RANDOM, Severity.LOW,
            "Non-cryptographic random generator", "Use SecureRandom for tokens, keys and nonces") {
        @Override
        boolean matches(StructuralNode node) {
            return node.insn().getOpcode() == Opcodes.NEW && "java/util/Random".equals(node.type().desc);
        }
    },

    WEAK_ALGORITHM_NAME(NodeKind.CONSTANT, VulnerabilityType.WEAK_CRYPTOGRAPHY, Severity.MEDIUM,
            "Weak cryptographic algorithm", "Use SHA-256+ for hashing and AES-GCM for encryption") {
        @Override
        boolean matches(StructuralNode node) {
            Object cst = node.constant().cst;
            if (!(cst instanceof String)) {
                return false;
            }
            String value = ((String) cst).toUpperCase(Locale.ROOT);
            return WEAK_ALGORITHMS.contains(value) || value.contains("/ECB/") || value.startsWith("DES/");
        }
    },

    UNSAFE_FIELD_ACCESS(NodeKind.FIELD_ACCESS, VulnerabilityType.PRIVILEGE_ESCALATION, Severity.HIGH,
            "Unsafe instance access", "Remove sun.misc.Unsafe usage") {
        @Override
        boolean matches(StructuralNode node) {
            return UNSAFE_OWNERS.contains(node.field().owner);
        }
    },

    CUSTOM_BOOTSTRAP(NodeKind.DYNAMIC_CALL, VulnerabilityType.DYNAMIC_CODE_LOADING, Severity.LOW,
            "Custom invokedynamic bootstrap", "Avoid custom call-site bootstraps in plugins") {
        @Override
        boolean matches(StructuralNode node) {
            return !STANDARD_BOOTSTRAPS.contains(node.dynamic().bsm.getOwner());
        }
    },

    NATIVE_METHOD(NodeKind.METHOD_DECLARATION, VulnerabilityType.NATIVE_CODE, Severity.MEDIUM,
            "Native method declaration", "Native code escapes every sandbox limit; remove it") {
        @Override
        boolean matches(StructuralNode node) {
            return (node.method().access & Opcodes.ACC_NATIVE) != 0;
        }
    },

    CLASS_LOADER_SUBCLASS(NodeKind.CLASS_DECLARATION, VulnerabilityType.DYNAMIC_CODE_LOADING, Severity.MEDIUM,
            "Custom class loader", "Do not load code from outside the plugin package") {
        @Override
        boolean matches(StructuralNode node) {
            String superName = node.owner().superName;
            return superName != null
                    && (CLASS_LOADERS.contains(superName) || "java/lang/ClassLoader".equals(superName));
        }
    },

    CUSTOM_TRUST_MANAGER(NodeKind.CLASS_DECLARATION, VulnerabilityType.INSECURE_CONFIGURATION, Severity.MEDIUM,
            "Custom TLS trust manager", "Rely on the platform trust store") {
        @Override
        boolean matches(StructuralNode node) {
            return node.owner().interfaces != null
                    && (node.owner().interfaces.contains("javax/net/ssl/X509TrustManager")
                    || node.owner().interfaces.contains("javax/net/ssl/HostnameVerifier"));
        }
    };

    private static final Set<String> UNSAFE_OWNERS = Set.of("sun/misc/Unsafe", "jdk/internal/misc/Unsafe");
    private static final Set<String> CLASS_LOADERS = Set.of(
            "java/net/URLClassLoader", "java/security/SecureClassLoader");
    private static final Set<String> WEAK_ALGORITHMS = Set.of(
            "MD2", "MD5", "SHA1", "SHA-1", "DES", "DESEDE", "RC2", "RC4", "ARCFOUR", "BLOWFISH");
    private static final Set<String> STANDARD_BOOTSTRAPS = Set.of(
            "java/lang/invoke/LambdaMetafactory",
            "java/lang/invoke/StringConcatFactory",
            "java/lang/runtime/ObjectMethods",
            "java/lang/runtime/SwitchBootstraps");

    private final NodeKind kind;
    private final VulnerabilityType type;
    private final Severity severity;
    private final String title;
    private final String remediation;

    StructuralRule(NodeKind kind, VulnerabilityType type, Severity severity, String title, String remediation) {
        this.kind = kind;
        this.type = type;
        this.severity = severity;
        this.title = title;
        this.remediation = remediation;
    }

    abstract boolean matches(StructuralNode node);

    public NodeKind getKind() {
        return kind;
    }

    public VulnerabilityType getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getRemediation() {
        return remediation;
    }
}
