/**
 * Exceptions raised by the mailbox client and the message assembler.
 *
 * <p>Structural problems with server supplied data raise {@link com.mimecast.mailfetch.exceptions.UnexpectedStructureException}.
 * <br>Configuration problems raise {@link com.mimecast.mailfetch.exceptions.InvalidParameterException}.
 * <br>Connection failures raise {@link com.mimecast.mailfetch.exceptions.ConnectionException}.
 * <br>Decoding problems are never raised and degrade to pass-through instead.
 */
package com.mimecast.mailfetch.exceptions;
