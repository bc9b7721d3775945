package com.raditha.luakit.config;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Fixed word lists shared by the lexer, the analyzers and the minifier.
 * <p>
 * Instances are immutable and handed to each component at construction.
 * The keyword set decides which names the lexer reports as keywords and which
 * generated short names are unusable; the global allow-list holds names the
 * host environment looks up by exact spelling, so they are never renamed or
 * reported as undeclared.
 */
public final class LuaVocabulary {

    /** Lua 5.1 to 5.4 reserved words plus the Luau {@code continue}. */
    public static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for",
            "function", "goto", "if", "in", "local", "nil", "not", "or",
            "repeat", "return", "then", "true", "until", "while", "continue");

    /** Standard library, Roblox services and environment globals. */
    public static final Set<String> GLOBALS = Set.of(
            // Lua runtime
            "_G", "_VERSION", "_ENV", "self", "assert", "collectgarbage", "dofile", "error",
            "gcinfo", "getfenv", "getmetatable", "ipairs", "load", "loadfile", "loadstring",
            "newproxy", "next", "pairs", "pcall", "print", "rawequal", "rawget", "rawlen",
            "rawset", "require", "select", "setfenv", "setmetatable", "tonumber", "tostring",
            "type", "unpack", "xpcall", "coroutine", "debug", "io", "math", "os", "package",
            "string", "table", "utf8", "bit32",
            // Roblox environment
            "game", "workspace", "Workspace", "script", "shared", "plugin", "Instance", "Enum",
            "Vector2", "Vector3", "CFrame", "UDim", "UDim2", "Color3", "BrickColor",
            "NumberSequence", "ColorSequence", "NumberRange", "Region3", "Faces", "Axes",
            "PhysicalProperties", "Ray", "RaycastParams", "Rect", "TweenInfo", "PathWaypoint",
            "Random", "DateTime", "task", "wait", "warn", "tick", "time", "elapsedTime",
            "spawn", "delay", "typeof",
            // Roblox services
            "Players", "ReplicatedStorage", "ServerScriptService", "ServerStorage", "StarterGui",
            "StarterPlayer", "StarterPack", "Lighting", "SoundService", "RunService",
            "UserInputService", "ContextActionService", "TweenService", "HttpService",
            "MarketplaceService", "DataStoreService", "MessagingService", "TeleportService",
            "BadgeService", "Debris", "PathfindingService", "CollectionService");

    private static final LuaVocabulary STANDARD = new LuaVocabulary(KEYWORDS, GLOBALS);

    private final Set<String> keywords;
    private final Set<String> globals;

    private LuaVocabulary(Set<String> keywords, Set<String> globals) {
        this.keywords = Set.copyOf(keywords);
        this.globals = Set.copyOf(globals);
    }

    /**
     * The built-in vocabulary.
     */
    public static LuaVocabulary standard() {
        return STANDARD;
    }

    /**
     * A vocabulary whose allow-list is extended with additional names.
     * Keywords cannot be extended.
     */
    public LuaVocabulary withExtraGlobals(Collection<String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Set<String> merged = new HashSet<>(globals);
        merged.addAll(extra);
        return new LuaVocabulary(keywords, merged);
    }

    public boolean isKeyword(String word) {
        return keywords.contains(word);
    }

    public boolean isGlobal(String name) {
        return globals.contains(name);
    }

    /**
     * True when a name may never be chosen as, or replaced by, a generated name.
     */
    public boolean isReserved(String name) {
        return isKeyword(name) || isGlobal(name);
    }

    public Set<String> keywords() {
        return keywords;
    }

    public Set<String> globals() {
        return globals;
    }
}
