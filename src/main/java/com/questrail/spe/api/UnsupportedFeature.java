package com.questrail.spe.api;

/**
 * A recognised structure that this reader does not decode. The file remains
 * readable; the structure is simply omitted from the result.
 */
public record UnsupportedFeature(String section, String name, String reason)
{
}
