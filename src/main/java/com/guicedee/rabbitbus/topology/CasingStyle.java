package com.guicedee.rabbitbus.topology;

/**
 * Casing applied to derived endpoint names
 */
public enum CasingStyle
{
    Preserve,
    LowerCase,
    UpperCase,
    KebabCase,
    SnakeCase,
    PascalCase,
    CamelCase
}
