package io.schedula.core.store;

import java.io.IOException;
import java.util.Map;

/**
 * Ordered-list storage keyed by path-like strings (e.g. {@code global/schedule}).
 * Items are flat JSON objects. Every method is atomic with respect to other calls on the same store.
 * Criteria match items whose fields are equal to every given value.
 */
public interface ListStore {

    /**
     * @throws StoreKeyNotFoundException when the list does not exist
     */
    ListPage<Map<String, Object>> listGet(String key, int offset, int limit) throws IOException;

    /**
     * @throws StoreKeyNotFoundException when the list or a matching item does not exist
     */
    Map<String, Object> listFind(String key, Map<String, Object> criteria) throws IOException;

    /**
     * Inserts the item at the head of the list, creating the list when absent.
     */
    void listUnshift(String key, Map<String, Object> item) throws IOException;

    /**
     * Overwrites the given fields of the first matching item, leaving other fields untouched.
     *
     * @throws StoreKeyNotFoundException when the list or a matching item does not exist
     */
    void listFindUpdate(String key, Map<String, Object> criteria, Map<String, Object> updates) throws IOException;

    /**
     * @return the removed item
     * @throws StoreKeyNotFoundException when the list or a matching item does not exist
     */
    Map<String, Object> listFindDelete(String key, Map<String, Object> criteria) throws IOException;

    /**
     * Schedules the key for deletion by the next maintenance sweep at or after the given epoch second.
     */
    void expire(String key, long atEpochSeconds) throws IOException;

    /**
     * Deletes every key whose expiry is at or before {@code nowEpochSeconds}.
     *
     * @return number of keys deleted
     */
    int purgeExpired(long nowEpochSeconds) throws IOException;

    static boolean matches(Map<String, Object> item, Map<String, Object> criteria) {
        for (Map.Entry<String, Object> entry : criteria.entrySet()) {
            Object actual = item.get(entry.getKey());
            if (actual == null || !String.valueOf(actual).equals(String.valueOf(entry.getValue()))) {
                return false;
            }
        }
        return true;
    }
}
