package com.paramkit.cli;

import com.paramkit.model.ParamAddress;
import lombok.NonNull;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from command line tokens to parameters.
 *
 * Tokens are stored exactly as they appear on the command line: "--name" for long
 * flags, "-c" for short flags and "0", "1", ... for positional indices. A token names at
 * most one parameter, and a parameter has at most one token of each {@link TokenType}.
 * Binding again replaces the previous binding.
 */
public class FlagBinder {
    private static final Logger log = LoggerFactory.getLogger(FlagBinder.class);

    public static final String LONG_FLAG_PREFIX = "--";
    public static final String SHORT_FLAG_PREFIX = "-";

    private final Map<String, Binding> bindings = new HashMap<>();
    private final Map<TokenType, Map<ParamAddress, String>> tokensByAddress = new EnumMap<>(TokenType.class);

    public enum TokenType {
        LONG_FLAG,
        SHORT_FLAG,
        INDEX
    }

    @Value
    private static class Binding {
        TokenType type;
        ParamAddress address;
    }

    /**
     * Binds "--name".
     *
     * @return the bound token
     */
    public String bindLongFlag(@NonNull String name, @NonNull ParamAddress address) {
        if (name.isBlank()) {
            throw new IllegalArgumentException("Long flag name must not be blank for " + address);
        }
        return bind(TokenType.LONG_FLAG, LONG_FLAG_PREFIX + name, address);
    }

    /**
     * Binds "-c" for a single-character short flag.
     *
     * @return the bound token
     */
    public String bindShortFlag(@NonNull String shortFlag, @NonNull ParamAddress address) {
        if (shortFlag.length() != 1 || shortFlag.charAt(0) == '-' || Character.isWhitespace(shortFlag.charAt(0))) {
            throw new IllegalArgumentException("Short flag must be a single character, got '" + shortFlag + "' for " + address);
        }
        return bind(TokenType.SHORT_FLAG, SHORT_FLAG_PREFIX + shortFlag, address);
    }

    /**
     * Binds the positional index, matched by ordinal position among non-flag tokens.
     *
     * @return the bound token
     */
    public String bindIndex(int index, @NonNull ParamAddress address) {
        if (index < 0) {
            throw new IllegalArgumentException("Positional index must not be negative, got " + index + " for " + address);
        }
        return bind(TokenType.INDEX, Integer.toString(index), address);
    }

    /**
     * Resolves a token exactly as given.
     */
    public Optional<ParamAddress> resolve(String token) {
        Binding binding = bindings.get(token);
        return binding == null ? Optional.empty() : Optional.of(binding.getAddress());
    }

    /**
     * Token of the given type bound to the parameter, if any.
     */
    public Optional<String> tokenFor(ParamAddress address, TokenType type) {
        return Optional.ofNullable(tokensByAddress.getOrDefault(type, Map.of()).get(address));
    }

    public boolean isBound(String token) {
        return bindings.containsKey(token);
    }

    public int size() {
        return bindings.size();
    }

    public void clear() {
        bindings.clear();
        tokensByAddress.clear();
    }

    private String bind(TokenType type, String token, ParamAddress address) {
        Map<ParamAddress, String> byAddress = tokensByAddress.computeIfAbsent(type, t -> new HashMap<>());

        // one token of this type per parameter
        String previousToken = byAddress.put(address, token);
        if (previousToken != null && !previousToken.equals(token)) {
            bindings.remove(previousToken);
        }

        // one parameter per token
        Binding previous = bindings.put(token, new Binding(type, address));
        if (previous != null && !previous.getAddress().equals(address)) {
            tokensByAddress.get(previous.getType()).remove(previous.getAddress());
            log.debug("Token {} moved from {} to {}", token, previous.getAddress(), address);
        }
        return token;
    }
}
