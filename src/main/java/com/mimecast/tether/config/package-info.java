/**
 * Client configuration.
 *
 * <p>Configuration is a single JSON5 file parsed with Gson.
 * <br>Every key is optional and has a default.
 *
 * @see com.mimecast.tether.config.ClientConfig
 */
package com.mimecast.tether.config;
