package org.kappapathways.common.codec;

import org.kappapathways.common.errorsor.ErrorsOr;

/** Two-way conversion where either direction may fail with readable messages. */
public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);
}
