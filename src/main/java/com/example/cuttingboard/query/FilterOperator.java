package com.example.cuttingboard.query;

import com.example.cuttingboard.QueryException;

import java.util.EnumSet;
import java.util.Set;

/**
 * The vocabulary of filter operators.
 *
 * <p>Every operator has a short code used in query strings, an antonym
 * (see {@link #inverse()}) and belongs to a family of related operators
 * a filter can be switched between (see {@link #related()}).
 */
public enum FilterOperator {

    EQ("eq", Family.COMPARISON),
    NE("ne", Family.COMPARISON),
    GT("gt", Family.COMPARISON),
    GE("ge", Family.COMPARISON),
    LT("lt", Family.COMPARISON),
    LE("le", Family.COMPARISON),

    IN("in", Family.MEMBERSHIP),
    NI("ni", Family.MEMBERSHIP),

    HASALL("hasall", Family.SET),
    HASNOTALL("hasnotall", Family.SET),
    HASANY("hasany", Family.SET),
    HASNONE("hasnone", Family.SET),
    HASONLY("hasonly", Family.SET),
    SUBSETOF("subsetof", Family.SET),
    NOTSUBSETOF("notsubsetof", Family.SET),
    SUPERSETOF("supersetof", Family.SET),
    NOTSUPERSETOF("notsupersetof", Family.SET),
    DISJOINTFROM("disjointfrom", Family.SET),
    INTERSECTS("intersects", Family.SET),
    EQUALS("equals", Family.SET),
    NOTEQUALS("notequals", Family.SET),

    MATCH("match", Family.MATCH),
    NMATCH("nmatch", Family.MATCH);

    /**
     * Groups of operators that apply to the same kind of filter value.
     */
    public enum Family {
        COMPARISON, MEMBERSHIP, SET, MATCH
    }

    private final String code;
    private final Family family;

    FilterOperator(String code, Family family) {
        this.code = code;
        this.family = family;
    }

    /**
     * Returns the operator with the given code.
     *
     * @throws QueryException if the code is not a known operator
     */
    public static FilterOperator of(String code) {
        for (FilterOperator op : values()) {
            if (op.code.equals(code)) {
                return op;
            }
        }
        throw new QueryException("unknown operator: '" + code + "'");
    }

    public String code() {
        return code;
    }

    public Family family() {
        return family;
    }

    /**
     * Returns {@code true} if the filter value is a collection of values
     * rather than a single one.
     */
    public boolean isMultiValued() {
        return family == Family.MEMBERSHIP || family == Family.SET;
    }

    /**
     * Returns the operator selecting the complement of this one.
     *
     * <p>{@code hasonly} is a synonym of {@code equals}: its inverse is
     * {@code notequals}, whose inverse is {@code equals}.
     */
    public FilterOperator inverse() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case GT -> LE;
            case LE -> GT;
            case LT -> GE;
            case GE -> LT;
            case IN -> NI;
            case NI -> IN;
            case HASALL -> HASNOTALL;
            case HASNOTALL -> HASALL;
            case HASNONE -> HASANY;
            case HASANY -> HASNONE;
            case SUBSETOF -> NOTSUBSETOF;
            case NOTSUBSETOF -> SUBSETOF;
            case SUPERSETOF -> NOTSUPERSETOF;
            case NOTSUPERSETOF -> SUPERSETOF;
            case DISJOINTFROM -> INTERSECTS;
            case INTERSECTS -> DISJOINTFROM;
            case EQUALS -> NOTEQUALS;
            case NOTEQUALS -> EQUALS;
            case HASONLY -> NOTEQUALS;
            case MATCH -> NMATCH;
            case NMATCH -> MATCH;
        };
    }

    /**
     * Returns all the operators of the same family, this one included.
     */
    public Set<FilterOperator> related() {
        Set<FilterOperator> rv = EnumSet.noneOf(FilterOperator.class);
        for (FilterOperator op : values()) {
            if (op.family == family) {
                rv.add(op);
            }
        }
        return rv;
    }

    @Override
    public String toString() {
        return code;
    }
}
