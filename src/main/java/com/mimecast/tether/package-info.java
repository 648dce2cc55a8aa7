/**
 * The main package for Tether, a device side client keeping a connection to a desktop companion.
 *
 * <p>On first contact the device has no credentials so it connects to the desktop insecurely
 * <br>and asks it to sign a certificate request. The desktop writes the signed certificate and its root
 * <br>certificate into the application's private directory.
 * <br>Every later connection is mutually authenticated TLS using those files.
 *
 * <p>The connection is kept alive with keepalive frames and re-established every two seconds when lost.
 * <br>Two consecutive failures trigger a fresh certificate exchange.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar tether.jar --help
 *      Device to desktop connection client
 *
 *      usage:   [-c &lt;arg&gt;] [-h]
 *      -c,--config &lt;arg&gt;   Path to client configuration file
 *      -h,--help           Show usage
 * </pre>
 */
package com.mimecast.tether;
