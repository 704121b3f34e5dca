package me.internalizable.authgate.attempt;

/**
 * The caller's credential validation. Returning normally means the credentials
 * were accepted; rejections are signalled by throwing.
 */
@FunctionalInterface
public interface CredentialCheck<T> {

    T verify() throws Exception;
}
