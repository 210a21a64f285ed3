package reia.lower;

// имена рантайма, которые попадают в выходное дерево
public record RuntimeTargets(
        Remote dispatch,
        Remote compare,
        Remote pow,
        Remote dictFromList,
        String stringTag,
        String legacyStringTag,
        String regexpTag,
        String legacyRegexpTag,
        String rangeTag,
        String moduleTag,
        String exceptionTag,
        String listTag,
        String listFlag,
        String toListMethod,
        String joinMethod
) {
    public record Remote(String module, String function) {}

    public static RuntimeTargets reia() {
        return new RuntimeTargets(
                new Remote("reia_dispatch", "call"),
                new Remote("reia_comparisons", "compare"),
                new Remote("math", "pow"),
                new Remote("dict", "from_list"),
                "reia_string",
                "string",
                "reia_regexp",
                "regexp",
                "reia_range",
                "reia_module",
                "exception",
                "list",
                "normal",
                "to_list",
                "join"
        );
    }
}
