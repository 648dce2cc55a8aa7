/**
 * Everything related to the device credentials and the TLS context built from them.
 *
 * <p>The {@link com.mimecast.tether.trust.CredentialStore} locates the files in the application's private directory.
 * <br>The {@link com.mimecast.tether.trust.TrustManager} validates the desktop against the stored root certificate.
 *
 * @see com.mimecast.tether.trust.SecurityContextFactory
 */
package com.mimecast.tether.trust;
