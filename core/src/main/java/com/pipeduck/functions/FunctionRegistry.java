package com.pipeduck.functions;

import com.pipeduck.functions.FunctionSignature.Kind;
import com.pipeduck.functions.FunctionSignature.ReturnTypeResolver;
import com.pipeduck.types.BooleanType;
import com.pipeduck.types.DataType;
import com.pipeduck.types.DataTypes;
import com.pipeduck.types.DateType;
import com.pipeduck.types.DecimalType;
import com.pipeduck.types.DoubleType;
import com.pipeduck.types.IntegerType;
import com.pipeduck.types.LongType;
import com.pipeduck.types.NullType;
import com.pipeduck.types.StringType;
import com.pipeduck.types.TimestampType;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of PPL functions: their signatures, return types and Spark SQL rendering.
 *
 * <p>Function categories:
 * <ul>
 *   <li>Aggregate functions: count, sum, avg, min, max, dc/distinct_count,
 *       stddev_samp, stddev_pop, var_samp, var_pop</li>
 *   <li>Date/time functions: date, timestamp, adddate, date_add, subdate, date_sub,
 *       now, year, month, day, datediff</li>
 *   <li>String functions: upper, lower, trim, length, concat, substring</li>
 *   <li>Math functions: abs, ceil, floor, round, sqrt, pow</li>
 *   <li>Conditional functions: coalesce, ifnull, if, isnull, isnotnull</li>
 * </ul>
 *
 * <p>Most functions render as a call of the same name; the others have a renamed
 * direct mapping or a custom {@link FunctionTranslator}. Names are case-insensitive.
 */
public final class FunctionRegistry {

    private static final Map<String, FunctionSignature> SIGNATURES = new HashMap<>();
    private static final Map<String, String> DIRECT_MAPPINGS = new HashMap<>();
    private static final Map<String, FunctionTranslator> CUSTOM_TRANSLATORS = new HashMap<>();

    static {
        initializeAggregateFunctions();
        initializeDateFunctions();
        initializeStringFunctions();
        initializeMathFunctions();
        initializeConditionalFunctions();
    }

    private FunctionRegistry() {}

    /**
     * Looks up the signature of a function.
     *
     * @param functionName the PPL function name
     * @return the signature, or empty for an unknown function
     */
    public static Optional<FunctionSignature> lookup(String functionName) {
        if (functionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SIGNATURES.get(normalize(functionName)));
    }

    public static boolean isSupported(String functionName) {
        return lookup(functionName).isPresent();
    }

    public static boolean isAggregate(String functionName) {
        return lookup(functionName).map(FunctionSignature::isAggregate).orElse(false);
    }

    /**
     * Returns whether a PPL aggregate counts distinct values ({@code dc}, {@code distinct_count}).
     */
    public static boolean isDistinctAggregate(String functionName) {
        String name = normalize(functionName);
        return name.equals("dc") || name.equals("distinct_count");
    }

    /**
     * Returns the host engine name of a function, e.g. {@code count} for {@code dc}.
     */
    public static String resolveName(String functionName) {
        String name = normalize(functionName);
        return DIRECT_MAPPINGS.getOrDefault(name, name);
    }

    /**
     * Translates a function call to Spark SQL.
     *
     * @param functionName the PPL function name
     * @param args the function arguments (as SQL strings)
     * @return the translated call
     * @throws UnsupportedOperationException if the function is not supported
     */
    public static String translate(String functionName, String... args) {
        if (functionName == null || functionName.isEmpty()) {
            throw new IllegalArgumentException("functionName must not be null or empty");
        }
        String name = normalize(functionName);

        FunctionTranslator translator = CUSTOM_TRANSLATORS.get(name);
        if (translator != null) {
            return translator.translate(args);
        }
        if (SIGNATURES.containsKey(name)) {
            return buildFunctionCall(DIRECT_MAPPINGS.getOrDefault(name, name), args);
        }
        throw new UnsupportedOperationException("Unsupported function: " + functionName);
    }

    private static String buildFunctionCall(String functionName, String... args) {
        if (args.length == 0) {
            return functionName + "()";
        }
        return functionName + "(" + String.join(", ", args) + ")";
    }

    private static String normalize(String functionName) {
        return functionName.toLowerCase(Locale.ROOT);
    }

    private static void register(String name, Kind kind, int minArgs, int maxArgs, ReturnTypeResolver returnType) {
        SIGNATURES.put(name, new FunctionSignature(name, kind, minArgs, maxArgs, returnType));
    }

    private static void scalar(String name, int minArgs, int maxArgs, ReturnTypeResolver returnType) {
        register(name, Kind.SCALAR, minArgs, maxArgs, returnType);
    }

    // ==================== Aggregate Functions ====================

    private static void initializeAggregateFunctions() {
        register("count", Kind.AGGREGATE, 0, 1, args -> LongType.get());
        register("dc", Kind.AGGREGATE, 1, 1, args -> LongType.get());
        register("distinct_count", Kind.AGGREGATE, 1, 1, args -> LongType.get());
        DIRECT_MAPPINGS.put("dc", "count");
        DIRECT_MAPPINGS.put("distinct_count", "count");

        register("sum", Kind.AGGREGATE, 1, 1, args -> sumType(numeric("sum", args.get(0))));
        register("avg", Kind.AGGREGATE, 1, 1, args -> avgType(numeric("avg", args.get(0))));
        register("min", Kind.AGGREGATE, 1, 1, args -> args.get(0));
        register("max", Kind.AGGREGATE, 1, 1, args -> args.get(0));

        for (String name : List.of("stddev_samp", "stddev_pop", "var_samp", "var_pop")) {
            register(name, Kind.AGGREGATE, 1, 1, args -> {
                numeric(name, args.get(0));
                return DoubleType.get();
            });
        }
    }

    /**
     * Sum widens integral input to long and floating input to double; a decimal
     * gains ten digits of precision.
     */
    static DataType sumType(DataType argType) {
        if (DataTypes.isIntegral(argType) || argType instanceof NullType) {
            return LongType.get();
        }
        if (argType instanceof DecimalType decType) {
            int newPrecision = Math.min(decType.precision() + 10, DecimalType.MAX_PRECISION);
            return new DecimalType(newPrecision, decType.scale());
        }
        return DoubleType.get();
    }

    /**
     * Average is double, or a decimal with four more digits of precision and scale.
     */
    static DataType avgType(DataType argType) {
        if (argType instanceof DecimalType decType) {
            int newPrecision = Math.min(decType.precision() + 4, DecimalType.MAX_PRECISION);
            int newScale = Math.min(decType.scale() + 4, newPrecision);
            return new DecimalType(newPrecision, newScale);
        }
        return DoubleType.get();
    }

    // ==================== Date/Time Functions ====================

    private static void initializeDateFunctions() {
        scalar("date", 1, 1, args -> {
            temporalOrString("date", args.get(0));
            return DateType.get();
        });
        DIRECT_MAPPINGS.put("date", "to_date");

        scalar("timestamp", 1, 1, args -> {
            temporalOrString("timestamp", args.get(0));
            return TimestampType.get();
        });
        DIRECT_MAPPINGS.put("timestamp", "to_timestamp");

        scalar("now", 0, 0, args -> TimestampType.get());
        DIRECT_MAPPINGS.put("now", "current_timestamp");

        // day offsets; interval offsets are rewritten to date arithmetic by the analyzer
        for (String name : List.of("adddate", "date_add", "subdate", "date_sub")) {
            scalar(name, 2, 2, args -> {
                temporalOrString(name, args.get(0));
                integral(name, args.get(1));
                return DateType.get();
            });
        }
        DIRECT_MAPPINGS.put("adddate", "date_add");
        DIRECT_MAPPINGS.put("subdate", "date_sub");

        for (String name : List.of("year", "month", "day")) {
            scalar(name, 1, 1, args -> {
                temporalOrString(name, args.get(0));
                return IntegerType.get();
            });
        }
        DIRECT_MAPPINGS.put("day", "dayofmonth");

        scalar("datediff", 2, 2, args -> {
            temporalOrString("datediff", args.get(0));
            temporalOrString("datediff", args.get(1));
            return IntegerType.get();
        });
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions() {
        for (String name : List.of("upper", "lower", "trim")) {
            scalar(name, 1, 1, args -> {
                string(name, args.get(0));
                return StringType.get();
            });
        }
        scalar("length", 1, 1, args -> {
            string("length", args.get(0));
            return IntegerType.get();
        });
        scalar("concat", 1, -1, args -> StringType.get());
        scalar("substring", 2, 3, args -> {
            string("substring", args.get(0));
            for (int i = 1; i < args.size(); i++) {
                integral("substring", args.get(i));
            }
            return StringType.get();
        });
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions() {
        scalar("abs", 1, 1, args -> numeric("abs", args.get(0)));
        for (String name : List.of("ceil", "floor")) {
            scalar(name, 1, 1, args -> {
                DataType type = numeric(name, args.get(0));
                return type instanceof DecimalType ? type : LongType.get();
            });
        }
        scalar("round", 1, 2, args -> {
            DataType type = numeric("round", args.get(0));
            if (args.size() == 2) {
                integral("round", args.get(1));
            }
            return type;
        });
        scalar("sqrt", 1, 1, args -> {
            numeric("sqrt", args.get(0));
            return DoubleType.get();
        });
        scalar("pow", 2, 2, args -> {
            numeric("pow", args.get(0));
            numeric("pow", args.get(1));
            return DoubleType.get();
        });
        DIRECT_MAPPINGS.put("pow", "power");
    }

    // ==================== Conditional Functions ====================

    private static void initializeConditionalFunctions() {
        scalar("coalesce", 1, -1, args -> commonType("coalesce", args));
        scalar("ifnull", 2, 2, args -> commonType("ifnull", args));
        CUSTOM_TRANSLATORS.put("ifnull", args -> buildFunctionCall("coalesce", args));

        scalar("if", 3, 3, args -> {
            if (!(args.get(0) instanceof BooleanType) && !(args.get(0) instanceof NullType)) {
                throw new IllegalArgumentException("if expects a boolean condition, got " + args.get(0));
            }
            return commonType("if", args.subList(1, 3));
        });

        scalar("isnull", 1, 1, args -> BooleanType.get());
        scalar("isnotnull", 1, 1, args -> BooleanType.get());
    }

    // ==================== Argument Checks ====================

    private static DataType numeric(String function, DataType type) {
        if (!DataTypes.isNumeric(type) && !(type instanceof NullType)) {
            throw new IllegalArgumentException(function + " expects a numeric argument, got " + type);
        }
        return type instanceof NullType ? DoubleType.get() : type;
    }

    private static void integral(String function, DataType type) {
        if (!DataTypes.isIntegral(type) && !(type instanceof NullType)) {
            throw new IllegalArgumentException(function + " expects an integer argument, got " + type);
        }
    }

    private static void string(String function, DataType type) {
        if (!(type instanceof StringType) && !(type instanceof NullType)) {
            throw new IllegalArgumentException(function + " expects a string argument, got " + type);
        }
    }

    private static void temporalOrString(String function, DataType type) {
        if (!DataTypes.isTemporal(type) && !(type instanceof StringType) && !(type instanceof NullType)) {
            throw new IllegalArgumentException(function + " expects a date, timestamp or string argument, got " + type);
        }
    }

    /**
     * The type all arguments share: the first non-null one, widened across numerics.
     */
    private static DataType commonType(String function, List<DataType> types) {
        DataType result = NullType.get();
        for (DataType type : types) {
            if (type instanceof NullType) {
                continue;
            }
            if (result instanceof NullType) {
                result = type;
            } else if (DataTypes.isNumeric(result) && DataTypes.isNumeric(type)) {
                result = DataTypes.widerNumeric(result, type);
            } else if (!result.equals(type)) {
                throw new IllegalArgumentException(
                    function + " arguments must share a type, got " + result + " and " + type);
            }
        }
        return result;
    }
}
