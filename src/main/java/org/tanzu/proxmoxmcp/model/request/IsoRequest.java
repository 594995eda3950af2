package org.tanzu.proxmoxmcp.model.request;

/**
 * ISO image and container template management on storage pools.
 */
public final class IsoRequest extends OperationRequest {

    private final IsoAction action;
    private final String node;
    private final String storage;
    private final String url;
    private final String filename;
    private final String checksum;
    private final String checksumAlgorithm;

    private IsoRequest(IsoAction action, String node, String storage, String url, String filename,
                       String checksum, String checksumAlgorithm) {
        super(OperationKind.ISO);
        this.action = action;
        this.node = node;
        this.storage = storage;
        this.url = url;
        this.filename = filename;
        this.checksum = checksum;
        this.checksumAlgorithm = checksumAlgorithm;
    }

    public static IsoRequest listIsos(String node, String storage) {
        return new IsoRequest(IsoAction.LIST_ISOS, node, storage, null, null, null, null);
    }

    public static IsoRequest listTemplates(String node, String storage) {
        return new IsoRequest(IsoAction.LIST_TEMPLATES, node, storage, null, null, null, null);
    }

    /**
     * Has the node fetch an image from a URL into the storage.
     *
     * @param node node doing the download
     * @param storage target storage, must accept iso content
     * @param url http or https source
     * @param filename name of the image in the storage, without '/'
     * @param checksum expected checksum, or null to skip verification
     * @param checksumAlgorithm algorithm of the checksum; null means sha256
     * @return the request
     */
    public static IsoRequest download(String node, String storage, String url, String filename,
                                      String checksum, String checksumAlgorithm) {
        return new IsoRequest(IsoAction.DOWNLOAD, node, storage, url, filename, checksum, checksumAlgorithm);
    }

    public static IsoRequest delete(String node, String storage, String filename) {
        return new IsoRequest(IsoAction.DELETE, node, storage, null, filename, null, null);
    }

    @Override
    public String getOperationName() {
        switch (action) {
            case LIST_ISOS:
                return "list_isos";
            case LIST_TEMPLATES:
                return "list_templates";
            case DOWNLOAD:
                return "download_iso";
            default:
                return "delete_iso";
        }
    }

    public IsoAction getAction() { return action; }
    public String getNode() { return node; }
    public String getStorage() { return storage; }
    public String getUrl() { return url; }
    public String getFilename() { return filename; }
    public String getChecksum() { return checksum; }
    public String getChecksumAlgorithm() { return checksumAlgorithm; }
}
