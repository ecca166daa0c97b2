package com.questrail.fasttest.assertion;

/**
 * Expression over a value with no capability beyond equality and identity.
 */
public final class ObjectExpression<T> extends AbstractValueExpression<ObjectExpression<T>, T>
{
    ObjectExpression(T actual) {
        super(actual);
    }
}
