/**
 * Provider-neutral requests and responses, and the static description of providers.
 * Everything here is immutable.
 */
package fr.lapetina.llm.gateway.domain.model;
