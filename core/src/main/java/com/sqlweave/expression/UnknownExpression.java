package com.sqlweave.expression;

/**
 * An expression whose value kind is not known statically, such as a raw
 * fragment or the result of a generic function call. Offers every operator.
 *
 * <p>All node classes in this package implement this interface; the narrower
 * views only restrict which operators the caller sees.
 */
public interface UnknownExpression extends BooleanExpression, NumberExpression, StringExpression, DateExpression {

    @Override
    default UnknownExpression min() {
        return NumberExpression.super.min();
    }

    @Override
    default UnknownExpression max() {
        return NumberExpression.super.max();
    }
}
