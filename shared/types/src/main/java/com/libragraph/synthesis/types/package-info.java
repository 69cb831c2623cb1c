/**
 * Pure Java value types shared across all synthesis modules.
 *
 * <p>Closed vocabularies for claims and the dependency edges between them. Each constant carries
 * the lower-case label used on the wire and in classifier output.
 * This module has no framework dependencies.
 */
package com.libragraph.synthesis.types;
