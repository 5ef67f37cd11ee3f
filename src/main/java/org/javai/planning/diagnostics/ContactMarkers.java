package org.javai.planning.diagnostics;

import java.util.List;
import org.javai.planning.model.Contact;

/**
 * Contacts found while re-checking a plan.
 *
 * @param frameId frame the contact positions are expressed in
 * @param clearPrevious whether viewers should drop markers from earlier checks first
 * @param contacts the contacts, empty when the plan was valid
 */
public record ContactMarkers(String frameId, boolean clearPrevious, List<Contact> contacts) {

	public ContactMarkers {
		contacts = contacts != null ? List.copyOf(contacts) : List.of();
	}

	public boolean isEmpty() {
		return contacts.isEmpty();
	}
}
