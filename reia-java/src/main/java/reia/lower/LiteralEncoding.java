package reia.lower;

/**
 * Кодировка строковых и списковых литералов. Зависит от того, какая грамматика
 * фронтенда построила дерево.
 */
public enum LiteralEncoding {
    /** список: голая цепочка cons; строка: {reia_string, [&lt;&lt;chars&gt;&gt;]} */
    CANONICAL,

    /** список: {list, {Cons, normal}}; строка: {string, &lt;&lt;chars&gt;&gt;} */
    LEGACY
}
