package org.dxworks.mesonactions.index;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Meson builtin functions known to the code actions, with the keyword arguments they accept.
 */
public final class BuiltinFunctions {

    public static final String STATIC_LIBRARY = "static_library";
    public static final String SHARED_LIBRARY = "shared_library";
    public static final String SHARED_MODULE = "shared_module";
    public static final String LIBRARY = "library";
    public static final String BOTH_LIBRARIES = "both_libraries";
    public static final String EXECUTABLE = "executable";
    public static final String DECLARE_DEPENDENCY = "declare_dependency";
    public static final String COPY_FILE = "copy_file";

    private static final List<String> BUILD_TARGET_KWARGS = List.of(
            "build_by_default", "build_rpath", "c_args", "cpp_args", "d_args", "d_import_dirs",
            "dependencies", "extra_files", "gnu_symbol_visibility", "implicit_include_directories",
            "include_directories", "install", "install_dir", "install_mode", "install_rpath", "install_tag",
            "link_args", "link_depends", "link_language", "link_whole", "link_with", "name_prefix",
            "name_suffix", "native", "objects", "override_options", "rust_args", "sources", "vala_args");

    private static final List<String> SHARED_ONLY_KWARGS = List.of("version", "soversion", "darwin_versions");
    private static final List<String> STATIC_ONLY_KWARGS = List.of("pic", "prelink");
    private static final List<String> INSTALL_KWARGS = List.of("install", "install_dir", "install_mode", "install_tag");

    private static final Map<String, Function> FUNCTIONS = new HashMap<>();

    static {
        register(STATIC_LIBRARY, BUILD_TARGET_KWARGS, STATIC_ONLY_KWARGS);
        register(SHARED_LIBRARY, BUILD_TARGET_KWARGS, SHARED_ONLY_KWARGS, List.of("vs_module_defs"));
        register(SHARED_MODULE, BUILD_TARGET_KWARGS, List.of("vs_module_defs"));
        register(LIBRARY, BUILD_TARGET_KWARGS, SHARED_ONLY_KWARGS, STATIC_ONLY_KWARGS, List.of("vs_module_defs"));
        register(BOTH_LIBRARIES, BUILD_TARGET_KWARGS, SHARED_ONLY_KWARGS, STATIC_ONLY_KWARGS,
                List.of("vs_module_defs"));
        register(EXECUTABLE, BUILD_TARGET_KWARGS,
                List.of("export_dynamic", "gui_app", "implib", "pie", "win_subsystem", "vs_module_defs"));
        register(DECLARE_DEPENDENCY, List.of("compile_args", "d_import_dirs", "d_module_versions", "dependencies",
                "extra_files", "include_directories", "link_args", "link_whole", "link_with", "objects", "sources",
                "variables", "version"));
        register(COPY_FILE, INSTALL_KWARGS);
        register("configure_file", INSTALL_KWARGS, List.of("capture", "command", "configuration", "copy",
                "depfile", "encoding", "format", "input", "output", "output_format"));
        register("dependency", List.of("allow_fallback", "default_options", "fallback", "include_type",
                "language", "method", "modules", "native", "not_found_message", "required", "static", "version"));
        register("files");
        register("get_option");
        register("include_directories", List.of("is_system"));
        register("install_headers", List.of("follow_symlinks", "install_dir", "install_mode", "preserve_path",
                "subdir"));
        register("message");
        register("project", List.of("default_options", "license", "license_files", "meson_version",
                "subproject_dir", "version"));
        register("subdir", List.of("if_found"));
    }

    private BuiltinFunctions() {
    }

    @SafeVarargs
    private static void register(String name, List<String>... kwargGroups) {
        Set<String> kwargs = new LinkedHashSet<>();
        for (List<String> group : kwargGroups) {
            kwargs.addAll(group);
        }
        FUNCTIONS.put(name, new Function(name, kwargs));
    }

    public static Optional<Function> lookup(String name) {
        return Optional.ofNullable(FUNCTIONS.get(name));
    }
}
